package io.jagged.layout;

/** Units accepted by the {@code datetime64} and {@code timedelta64} primitive types. */
public enum DateTimeUnit {
  YEAR("Y"),
  MONTH("M"),
  WEEK("W"),
  DAY("D"),
  HOUR("h"),
  MINUTE("m"),
  SECOND("s"),
  MILLISECOND("ms"),
  MICROSECOND("us"),
  NANOSECOND("ns"),
  PICOSECOND("ps"),
  FEMTOSECOND("fs"),
  ATTOSECOND("as");

  private final String code;

  DateTimeUnit(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
