package io.jagged.generator.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jagged.generator.tape.ChoiceSequenceTape;
import io.jagged.generator.tape.RandomTape;
import io.jagged.layout.Content;
import io.jagged.layout.DType;
import io.jagged.layout.LayoutValidationException;
import io.jagged.layout.NumpyContent;
import io.jagged.layout.PrimitiveType;
import io.jagged.layout.StringContent;
import io.jagged.layout.UnionContent;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class UnionDrawsTest {
  private static final NumpyContent THREE =
      new NumpyContent(DType.of(PrimitiveType.INT8), new long[] {1, 2, 3});
  private static final StringContent TWO = new StringContent(List.of("a", "b"));

  @Test
  void everyElementIsReachableExactlyOnce() {
    UnionContent u =
        (UnionContent) UnionDraws.draw(new RandomTape(8L), List.of(THREE, TWO), Integer.MAX_VALUE);
    assertThat(u.length()).isEqualTo(5);
    Set<String> pairs = new HashSet<>();
    for (int i = 0; i < u.length(); i++) {
      pairs.add(u.tagAt(i) + ":" + u.indexAt(i));
    }
    assertThat(pairs).containsExactlyInAnyOrder("0:0", "0:1", "0:2", "1:0", "1:1");
  }

  @Test
  void simplestDrawKeepsChildOrder() {
    UnionContent u =
        (UnionContent) UnionDraws.draw(new ChoiceSequenceTape(), List.of(THREE, TWO), 10);
    assertThat(u.tags()).containsExactly(new byte[] {0, 0, 0, 1, 1});
    assertThat(u.index()).containsExactly(0, 1, 2, 0, 1);
  }

  @Test
  void truncatesPastTheLengthCeiling() {
    Content u = UnionDraws.draw(new RandomTape(1L), List.of(THREE, TWO), 2);
    assertThat(u.length()).isEqualTo(2);
  }

  @Test
  void rejectsNestedUnions() {
    Content inner = UnionDraws.draw(new RandomTape(1L), List.of(THREE, TWO), 10);
    assertThatThrownBy(() -> UnionDraws.draw(new RandomTape(1L), List.of(inner, TWO), 10))
        .isInstanceOf(LayoutValidationException.class);
  }

  @Test
  void rejectsTooFewOrTooManyAlternativesBeforeDrawing() {
    ChoiceSequenceTape tape = new ChoiceSequenceTape();
    assertThatThrownBy(() -> UnionDraws.draw(tape, List.of(THREE), 10))
        .isInstanceOf(IllegalArgumentException.class);
    List<Content> wide = Collections.nCopies(UnionContent.MAX_CONTENTS + 1, TWO);
    assertThatThrownBy(() -> UnionDraws.draw(tape, wide, 10))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("got 129");
    assertThat(tape.consumed()).isZero();
  }

  @Test
  void acceptsTheWidestUnion() {
    List<Content> widest = Collections.nCopies(UnionContent.MAX_CONTENTS, TWO);
    UnionContent u = (UnionContent) UnionDraws.draw(new RandomTape(3L), widest, 1000);
    assertThat(u.length()).isEqualTo(2 * UnionContent.MAX_CONTENTS);
    for (int i = 0; i < u.length(); i++) {
      assertThat(u.tagAt(i)).isBetween(0, UnionContent.MAX_CONTENTS - 1);
    }
  }
}
