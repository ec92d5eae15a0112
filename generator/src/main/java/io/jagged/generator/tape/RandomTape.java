package io.jagged.generator.tape;

import java.util.Random;

/** Tape drawing fresh decisions from a {@link Random}. Replayable through its seed. */
public final class RandomTape extends AbstractDecisionTape {
  private final Random random;

  public RandomTape(Random random) {
    this.random = random;
  }

  public RandomTape(long seed) {
    this(new Random(seed));
  }

  @Override
  protected long nextChoice() {
    return random.nextLong();
  }
}
