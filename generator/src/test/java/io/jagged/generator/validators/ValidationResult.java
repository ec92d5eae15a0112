package io.jagged.generator.validators;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Accumulates invariant violations so a failing property reports all of them at once. */
public class ValidationResult {
  private final List<String> errors = new ArrayList<>();

  public void addError(String error) {
    errors.add(error);
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  public List<String> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  /**
   * Returns a formatted report of all errors.
   *
   * @return multi-line string with all validation messages
   */
  public String getReport() {
    if (isValid()) {
      return "Validation passed";
    }
    StringBuilder sb = new StringBuilder("Errors:\n");
    for (String error : errors) {
      sb.append("  - ").append(error).append("\n");
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return getReport();
  }
}
