package io.croncalc;

import java.util.Optional;

/** Exception thrown when a schedule expression cannot be parsed. */
public final class CronException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending token, if any. */
  private final String token;

  /** The location of the offending field in the input. */
  private final Span span;

  /** The original input string. */
  private final String input;

  private CronException(
      ErrorKind kind, String message, String token, Span span, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.token = token;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates an error for an absent expression.
   *
   * @return a new CronException of kind {@link ErrorKind#NULL_INPUT}
   */
  public static CronException nullInput() {
    return new CronException(ErrorKind.NULL_INPUT, "expression is null", null, null, null, null);
  }

  /**
   * Creates an error for an expression with the wrong number of fields.
   *
   * @param count the number of fields found
   * @param input the original input string
   * @return a new CronException of kind {@link ErrorKind#TOKEN_COUNT}
   */
  public static CronException tokenCount(int count, String input) {
    return new CronException(
        ErrorKind.TOKEN_COUNT,
        "expression must contain 5 or 6 fields (actual " + count + ")",
        null,
        null,
        input,
        null);
  }

  /**
   * Creates an error for a numeric literal outside its field's range.
   *
   * @param value the offending value
   * @param min the field's minimum value
   * @param max the field's maximum value
   * @param token the token containing the value
   * @return a new CronException of kind {@link ErrorKind#VALUE_OUT_OF_RANGE}
   */
  public static CronException valueOutOfRange(int value, int min, int max, String token) {
    return new CronException(
        ErrorKind.VALUE_OUT_OF_RANGE,
        value + " is out of [" + min + ", " + max + "] in \"" + token + "\"",
        token,
        null,
        null,
        null);
  }

  /**
   * Creates an error for a symbolic value that matches no known name.
   *
   * @param name the unresolved name
   * @param known the names the field accepts
   * @param token the token containing the name
   * @return a new CronException of kind {@link ErrorKind#UNKNOWN_NAME}
   */
  public static CronException unknownName(String name, Iterable<String> known, String token) {
    return new CronException(
        ErrorKind.UNKNOWN_NAME,
        "\""
            + name
            + "\" is not a known value name in \""
            + token
            + "\", use one of: "
            + String.join(", ", known),
        token,
        null,
        null,
        null);
  }

  /**
   * Creates an error for any other syntactic failure.
   *
   * @param message the error message
   * @param token the offending token
   * @return a new CronException of kind {@link ErrorKind#MALFORMED_TOKEN}
   */
  public static CronException malformedToken(String message, String token) {
    return new CronException(ErrorKind.MALFORMED_TOKEN, message, token, null, null, null);
  }

  /**
   * Returns a copy of this error located at the given span of the input.
   *
   * @param span the location of the offending field
   * @param input the original input string
   * @return a new CronException with the same kind and message, caused by this one
   */
  public CronException locate(Span span, String input) {
    return new CronException(kind, getMessage(), token, span, input, this);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the offending token, if available.
   *
   * @return the token, or empty if not available
   */
  public Optional<String> token() {
    return Optional.ofNullable(token);
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message with an underline below the offending field.
   *
   * <p>For located errors, produces output like:
   *
   * <pre>
   * error: 61 is out of [0, 59] in "61"
   *   0 61 * * *
   *     ^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");

      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));

      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
