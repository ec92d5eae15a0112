package io.jagged.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ListContentTest {
  private static final NumpyContent FIVE =
      new NumpyContent(DType.of(PrimitiveType.INT32), new long[] {10, 11, 12, 13, 14});

  @Test
  void offsetsDelimitSublists() {
    ListOffsetContent l = new ListOffsetContent(new long[] {0, 2, 2, 5}, FIVE);
    assertThat(l.length()).isEqualTo(3);
    assertThat(JaggedArray.of(l).toList())
        .containsExactly(List.of(10L, 11L), List.of(), List.of(12L, 13L, 14L));
  }

  @Test
  void singleOffsetMeansNoSublists() {
    assertThat(new ListOffsetContent(new long[] {0}, FIVE).length()).isZero();
  }

  @Test
  void rejectsDecreasingOffsets() {
    assertThatThrownBy(() -> new ListOffsetContent(new long[] {0, 3, 2}, FIVE))
        .isInstanceOf(LayoutValidationException.class)
        .hasMessageContaining("decrease");
  }

  @Test
  void rejectsOffsetsPastTheChild() {
    assertThatThrownBy(() -> new ListOffsetContent(new long[] {0, 6}, FIVE))
        .isInstanceOf(LayoutValidationException.class)
        .hasMessageContaining("outside [0, 5]");
  }

  @Test
  void rejectsMissingOffsets() {
    assertThatThrownBy(() -> new ListOffsetContent(new long[0], FIVE))
        .isInstanceOf(LayoutValidationException.class);
  }

  @Test
  void startsAndStopsMayOverlapAndReorder() {
    ListContent l = new ListContent(new long[] {3, 0, 1}, new long[] {5, 2, 1}, FIVE);
    assertThat(JaggedArray.of(l).toList())
        .containsExactly(List.of(13L, 14L), List.of(10L, 11L), List.of());
  }

  @Test
  void rejectsStartAfterStop() {
    assertThatThrownBy(() -> new ListContent(new long[] {3}, new long[] {2}, FIVE))
        .isInstanceOf(LayoutValidationException.class);
  }

  @Test
  void rejectsMismatchedStartsAndStops() {
    assertThatThrownBy(() -> new ListContent(new long[] {0, 1}, new long[] {1}, FIVE))
        .isInstanceOf(LayoutValidationException.class)
        .hasMessageContaining("starts has 2 entries");
  }
}
