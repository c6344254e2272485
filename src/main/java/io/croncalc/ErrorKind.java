package io.croncalc;

/** The type of error that occurred while parsing a schedule expression. */
public enum ErrorKind {
  /** The expression was absent. */
  NULL_INPUT("null-input"),
  /** The expression did not split into 5 or 6 fields. */
  TOKEN_COUNT("token-count"),
  /** A numeric literal lies outside its field's range. */
  VALUE_OUT_OF_RANGE("value-out-of-range"),
  /** A symbolic value matched no month or weekday name. */
  UNKNOWN_NAME("unknown-name"),
  /** Any other syntactic failure, including invalid step specifiers. */
  MALFORMED_TOKEN("malformed-token");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
