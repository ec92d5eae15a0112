package io.jagged.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class RegularContentTest {

  private static NumpyContent int64s(long... values) {
    return new NumpyContent(DType.of(PrimitiveType.INT64), values);
  }

  @Test
  void lengthIsChildLengthDividedBySize() {
    RegularContent r = new RegularContent(int64s(1, 2, 3, 4, 5, 6), 3);
    assertThat(r.length()).isEqualTo(2);
    assertThat(r.size()).isEqualTo(3);
    assertThat(r.children()).containsExactly(r.content());
  }

  @Test
  void zeroSizeUsesStandInLength() {
    RegularContent r = new RegularContent(EmptyContent.INSTANCE, 0, 4);
    assertThat(r.length()).isEqualTo(4);
    assertThat(JaggedArray.of(r).toList())
        .containsExactly(List.of(), List.of(), List.of(), List.of());
  }

  @Test
  void rejectsChildLengthThatIsNotAMultiple() {
    assertThatThrownBy(() -> new RegularContent(int64s(1, 2, 3), 2))
        .isInstanceOf(LayoutValidationException.class)
        .hasMessageContaining("not a multiple");
  }

  @Test
  void rejectsNegativeSize() {
    assertThatThrownBy(() -> new RegularContent(int64s(), -1))
        .isInstanceOfSatisfying(
            LayoutValidationException.class, e -> assertThat(e.getErrorCode()).isEqualTo("LENGTH"));
  }
}
