package io.jagged.layout;

/**
 * Thrown when a content node is assembled from malformed index or length data.
 *
 * <p>Generated trees are valid by construction, so this exception signals a defect in whatever
 * assembled the node. It is never caught by the generation engine.
 */
public class LayoutValidationException extends RuntimeException {
  private final String context;
  private final String errorCode;

  public LayoutValidationException(String message, String context, String errorCode) {
    super(formatMessage(message, context, errorCode));
    this.context = context;
    this.errorCode = errorCode;
  }

  private static String formatMessage(String message, String context, String errorCode) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (errorCode != null) {
      sb.append(" [Error Code: ").append(errorCode).append("]");
    }
    return sb.toString();
  }

  public String getContext() {
    return context;
  }

  public String getErrorCode() {
    return errorCode;
  }

  static LayoutValidationException indexOutOfRange(
      ContentKind kind, String indexName, int position, long value, int bound) {
    return new LayoutValidationException(
        String.format(
            "%s[%d] = %d is outside [0, %d]", indexName, position, value, bound),
        kind.name(),
        "INDEX");
  }

  static LayoutValidationException lengthMismatch(ContentKind kind, String detail) {
    return new LayoutValidationException(detail, kind.name(), "LENGTH");
  }
}
