package io.jagged.generator.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.jagged.generator.tape.ChoiceSequenceTape;
import io.jagged.generator.tape.RandomTape;
import io.jagged.layout.Content;
import io.jagged.layout.DType;
import io.jagged.layout.NumpyContent;
import io.jagged.layout.PrimitiveType;
import io.jagged.layout.RecordContent;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecordDrawsTest {

  private static NumpyContent ofLength(int n) {
    return new NumpyContent(DType.of(PrimitiveType.INT32), new long[n]);
  }

  @Test
  void sharedLengthIsTheShortestField() {
    List<Content> fields = List.of(ofLength(5), ofLength(3), ofLength(7));
    RecordContent r =
        (RecordContent) RecordDraws.draw(new RandomTape(9L), fields, true, Integer.MAX_VALUE);
    assertThat(r.length()).isEqualTo(3);
  }

  @Test
  void lengthCeilingTightensTheSharedLength() {
    List<Content> fields = List.of(ofLength(5), ofLength(3));
    assertThat(RecordDraws.draw(new RandomTape(9L), fields, true, 2).length()).isEqualTo(2);
  }

  @Test
  void tuplesOnlyWhenAllowed() {
    RandomTape tape = new RandomTape(10L);
    for (int i = 0; i < 100; i++) {
      RecordContent r = (RecordContent) RecordDraws.draw(tape, List.of(ofLength(1)), false, 5);
      assertThat(r.isTuple()).isFalse();
    }
    // coin = 1 picks the tuple
    RecordContent tuple =
        (RecordContent) RecordDraws.draw(new ChoiceSequenceTape(1), List.of(ofLength(1)), true, 5);
    assertThat(tuple.isTuple()).isTrue();
  }

  @Test
  void collidingNamesAreMadeUnique() {
    // every drawn name is empty when the tape runs dry
    List<String> names = RecordDraws.drawFieldNames(new ChoiceSequenceTape(), 4);
    assertThat(names).containsExactly("", "f1", "f2", "f3").doesNotHaveDuplicates();
  }

  @Test
  void namesAreShortAsciiLetters() {
    RandomTape tape = new RandomTape(12L);
    for (int i = 0; i < 100; i++) {
      List<String> names = RecordDraws.drawFieldNames(tape, 5);
      assertThat(names).doesNotHaveDuplicates();
      for (String name : names) {
        assertThat(name).matches("[a-zA-Z]{0,3}|f\\d_*");
      }
    }
  }
}
