package io.jagged.generator.api;

/**
 * Thrown when generator options cannot produce any value at all, such as when every leaf kind is
 * disabled. Raised eagerly, before the first decision is drawn.
 */
public class JaggedConfigurationException extends RuntimeException {
  private final String context;
  private final String errorCode;

  public JaggedConfigurationException(String message) {
    this(message, null);
  }

  public JaggedConfigurationException(String message, String context) {
    super(formatMessage(message, context));
    this.context = context;
    this.errorCode = "CONFIG";
  }

  private static String formatMessage(String message, String context) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    sb.append(" [Error Code: CONFIG]");
    return sb.toString();
  }

  public String getContext() {
    return context;
  }

  public String getErrorCode() {
    return errorCode;
  }

  public static JaggedConfigurationException noLeafKind() {
    return new JaggedConfigurationException(
        "at least one leaf content type must be allowed",
        "allowNumpy, allowEmpty, allowString, allowBytestring");
  }

  public static JaggedConfigurationException negative(String option, int value) {
    return new JaggedConfigurationException(
        String.format("'%s' must be non-negative, got %d", option, value), option);
  }
}
