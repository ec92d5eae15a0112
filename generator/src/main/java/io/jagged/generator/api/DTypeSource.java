package io.jagged.generator.api;

import io.jagged.layout.DType;
import java.util.Arrays;
import java.util.List;

/** Supplies one concrete dtype per numeric leaf. */
@FunctionalInterface
public interface DTypeSource {

  /**
   * Draws the dtype for the next numeric leaf.
   *
   * @param tape the decision tape
   * @return the dtype
   */
  DType draw(DecisionTape tape);

  /**
   * Returns a source over every supported dtype.
   *
   * @return the default source
   */
  static DTypeSource all() {
    return of(DType.SUPPORTED);
  }

  /**
   * Returns a source choosing uniformly among the given dtypes.
   *
   * @param dtypes the candidates, must not be empty
   * @return the source
   * @throws JaggedConfigurationException if {@code dtypes} is empty
   */
  static DTypeSource of(List<DType> dtypes) {
    List<DType> copy = List.copyOf(dtypes);
    if (copy.isEmpty()) {
      throw new JaggedConfigurationException("dtype source needs at least one dtype", "dtypes");
    }
    return tape -> tape.choose(copy);
  }

  static DTypeSource of(DType... dtypes) {
    return of(Arrays.asList(dtypes));
  }
}
