package io.jagged.generator.tape;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import java.util.List;

/**
 * Tape replaying a fixed sequence of raw choices.
 *
 * <p>Once the sequence runs out every further draw returns its lower bound, so any prefix of a
 * sequence still yields a complete, minimal tree. Shortening the sequence or moving its entries
 * towards zero therefore shrinks the generated value.
 */
public final class ChoiceSequenceTape extends AbstractDecisionTape {
  private final LongList choices;
  private int position;

  public ChoiceSequenceTape(List<Long> choices) {
    this.choices = new LongArrayList(choices);
  }

  public ChoiceSequenceTape(long... choices) {
    this.choices = LongArrayList.wrap(choices.clone());
  }

  @Override
  protected long nextChoice() {
    if (position >= choices.size()) {
      return 0L;
    }
    return choices.getLong(position++);
  }

  /**
   * Returns whether every recorded choice has been consumed.
   *
   * @return {@code true} once draws fall back to lower bounds
   */
  public boolean isExhausted() {
    return position >= choices.size();
  }
}
