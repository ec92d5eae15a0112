package io.jagged.generator.leaf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jagged.generator.api.DTypeSource;
import io.jagged.generator.api.GeneratorOptions;
import io.jagged.generator.api.JaggedConfigurationException;
import io.jagged.generator.tape.RandomTape;
import io.jagged.layout.BytestringContent;
import io.jagged.layout.Complex;
import io.jagged.layout.Content;
import io.jagged.layout.ContentKind;
import io.jagged.layout.Contents;
import io.jagged.layout.DType;
import io.jagged.layout.DateTimeUnit;
import io.jagged.layout.NumpyContent;
import io.jagged.layout.PrimitiveType;
import io.jagged.layout.StringContent;
import java.util.List;
import org.junit.jupiter.api.Test;

class LeafGeneratorsTest {

  @Test
  void enabledKindsFollowOptions() {
    LeafGenerators leaves =
        LeafGenerators.from(
            GeneratorOptions.builder().allowEmpty(false).allowBytestring(false).build());
    assertThat(leaves.kinds()).containsExactly(LeafKind.NUMPY, LeafKind.STRING);
    assertThat(leaves.canHoldElements()).isTrue();
  }

  @Test
  void noLeafKindIsAConfigurationError() {
    GeneratorOptions options =
        GeneratorOptions.builder()
            .allowNumpy(false)
            .allowEmpty(false)
            .allowString(false)
            .allowBytestring(false)
            .build();
    assertThatThrownBy(() -> LeafGenerators.from(options))
        .isInstanceOf(JaggedConfigurationException.class)
        .hasMessageContaining("at least one leaf content type must be allowed");
  }

  @Test
  void placeholdersAloneHoldNothing() {
    LeafGenerators leaves =
        LeafGenerators.from(
            GeneratorOptions.builder()
                .allowNumpy(false)
                .allowString(false)
                .allowBytestring(false)
                .build());
    assertThat(leaves.canHoldElements()).isFalse();
    assertThatThrownBy(() -> leaves.generate(new RandomTape(1L), 2, 2))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void placeholderIsSkippedWhenElementsAreRequired() {
    LeafGenerators leaves = LeafGenerators.from(GeneratorOptions.DEFAULT);
    RandomTape tape = new RandomTape(21L);
    for (int i = 0; i < 300; i++) {
      Content leaf = leaves.generate(tape, 3, 3);
      assertThat(leaf.kind()).isNotEqualTo(ContentKind.EMPTY);
      assertThat(leaf.length()).isEqualTo(3);
    }
  }

  @Test
  void textIsWellFormed() {
    StringLeafGenerator strings = new StringLeafGenerator(16);
    RandomTape tape = new RandomTape(22L);
    for (int i = 0; i < 200; i++) {
      StringContent leaf = (StringContent) strings.generate(tape, 0, 5);
      for (String s : leaf.values()) {
        assertThat(s.codePointCount(0, s.length())).isLessThanOrEqualTo(16);
        for (int j = 0; j < s.length(); j++) {
          char c = s.charAt(j);
          if (Character.isHighSurrogate(c)) {
            assertThat(j + 1 < s.length() && Character.isLowSurrogate(s.charAt(j + 1))).isTrue();
            j++;
          } else {
            assertThat(Character.isLowSurrogate(c)).isFalse();
          }
        }
      }
    }
  }

  @Test
  void bytestringsRespectMaxLength() {
    BytestringLeafGenerator bytes = new BytestringLeafGenerator(4);
    BytestringContent leaf = (BytestringContent) bytes.generate(new RandomTape(23L), 6, 6);
    assertThat(leaf.length()).isEqualTo(6);
    for (int i = 0; i < leaf.length(); i++) {
      assertThat(leaf.valueAt(i).length).isLessThanOrEqualTo(4);
    }
  }

  @Test
  void noNanOrNatUnlessAllowed() {
    NumpyLeafGenerator numbers =
        new NumpyLeafGenerator(
            DTypeSource.of(
                DType.of(PrimitiveType.FLOAT32),
                DType.of(PrimitiveType.FLOAT64),
                DType.of(PrimitiveType.DATETIME64, DateTimeUnit.NANOSECOND)),
            false);
    RandomTape tape = new RandomTape(24L);
    for (int i = 0; i < 500; i++) {
      assertThat(Contents.anyNanOrNat(numbers.generate(tape, 0, 10))).isFalse();
    }
  }

  @Test
  void nanAppearsWhenAllowed() {
    NumpyLeafGenerator numbers =
        new NumpyLeafGenerator(DTypeSource.of(DType.of(PrimitiveType.FLOAT64)), true);
    RandomTape tape = new RandomTape(25L);
    boolean sawNan = false;
    for (int i = 0; i < 500 && !sawNan; i++) {
      sawNan = Contents.anyNan(numbers.generate(tape, 10, 10));
    }
    assertThat(sawNan).isTrue();
  }

  @Test
  void integerCellsStayInRange() {
    NumpyLeafGenerator numbers =
        new NumpyLeafGenerator(DTypeSource.of(List.of(DType.of(PrimitiveType.UINT8))), false);
    NumpyContent leaf = (NumpyContent) numbers.generate(new RandomTape(26L), 50, 50);
    for (long cell : leaf.cells()) {
      assertThat(cell).isBetween(0L, 255L);
    }
  }

  @Test
  void complexAndHalfCellsHonourNanGating() {
    DTypeSource wide =
        DTypeSource.of(
            DType.of(PrimitiveType.FLOAT16),
            DType.of(PrimitiveType.COMPLEX64),
            DType.of(PrimitiveType.COMPLEX128));
    NumpyLeafGenerator strict = new NumpyLeafGenerator(wide, false);
    RandomTape tape = new RandomTape(27L);
    for (int i = 0; i < 500; i++) {
      assertThat(Contents.anyNan(strict.generate(tape, 0, 10))).isFalse();
    }

    NumpyLeafGenerator lenient =
        new NumpyLeafGenerator(DTypeSource.of(DType.of(PrimitiveType.COMPLEX64)), true);
    boolean sawNan = false;
    for (int i = 0; i < 500 && !sawNan; i++) {
      sawNan = Contents.anyNan(lenient.generate(tape, 10, 10));
    }
    assertThat(sawNan).isTrue();
  }

  @Test
  void complexLeavesCarryImaginaryParts() {
    NumpyLeafGenerator numbers =
        new NumpyLeafGenerator(DTypeSource.of(DType.of(PrimitiveType.COMPLEX128)), false);
    NumpyContent leaf = (NumpyContent) numbers.generate(new RandomTape(28L), 8, 8);
    assertThat(leaf.imagCells()).hasSize(8);
    assertThat(leaf.valueAt(0)).isInstanceOf(Complex.class);
  }
}
