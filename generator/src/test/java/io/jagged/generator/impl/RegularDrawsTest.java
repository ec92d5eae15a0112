package io.jagged.generator.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.jagged.generator.api.Outcome;
import io.jagged.generator.tape.ChoiceSequenceTape;
import io.jagged.generator.tape.RandomTape;
import io.jagged.layout.Content;
import io.jagged.layout.DType;
import io.jagged.layout.EmptyContent;
import io.jagged.layout.NumpyContent;
import io.jagged.layout.PrimitiveType;
import io.jagged.layout.RegularContent;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RegularDrawsTest {

  private static NumpyContent ofLength(int n) {
    return new NumpyContent(DType.of(PrimitiveType.INT64), new long[n]);
  }

  @Test
  void sizesAreDivisorsOfTheChildLength() {
    Set<Integer> sizes = new HashSet<>();
    RandomTape tape = new RandomTape(11L);
    for (int i = 0; i < 500; i++) {
      RegularContent r =
          (RegularContent) RegularDraws.draw(tape, ofLength(12), Integer.MAX_VALUE).get();
      assertThat(12 % r.size()).isZero();
      sizes.add(r.size());
    }
    assertThat(sizes).containsExactlyInAnyOrder(1, 2, 3, 4);
  }

  @Test
  void emptyChildAdmitsZeroSizeWithStandInLength() {
    boolean sawZero = false;
    RandomTape tape = new RandomTape(5L);
    for (int i = 0; i < 500 && !sawZero; i++) {
      RegularContent r =
          (RegularContent) RegularDraws.draw(tape, EmptyContent.INSTANCE, 3).get();
      if (r.size() == 0) {
        sawZero = true;
        assertThat(r.length()).isBetween(0, 3);
      } else {
        assertThat(r.length()).isZero();
      }
    }
    assertThat(sawZero).isTrue();
  }

  @Test
  void simplestDrawGroupsByOne() {
    Content r = RegularDraws.draw(new ChoiceSequenceTape(), ofLength(4), 10).get();
    assertThat(((RegularContent) r).size()).isEqualTo(1);
    assertThat(r.length()).isEqualTo(4);
  }

  @Test
  void lengthCeilingRestrictsSizes() {
    RandomTape tape = new RandomTape(2L);
    for (int i = 0; i < 100; i++) {
      Content r = RegularDraws.draw(tape, ofLength(8), 2).get();
      assertThat(((RegularContent) r).size()).isEqualTo(4);
    }
  }

  @Test
  void discardsWhenNoSizeFitsTheCeiling() {
    Outcome<Content> outcome = RegularDraws.draw(new RandomTape(0L), ofLength(7), 3);
    assertThat(outcome.isDiscarded()).isTrue();
    assertThat(outcome.reason()).contains("divides 7");
  }
}
