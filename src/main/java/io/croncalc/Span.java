package io.croncalc;

/**
 * Location of one whitespace-separated field token within a schedule expression, as character
 * offsets into the original input. Parse errors carry the span of the field that failed so it can
 * be underlined in {@link CronException#displayRich()}.
 *
 * @param start offset of the token's first character
 * @param end offset just past the token's last character
 */
public record Span(int start, int end) {
  /**
   * Returns the number of carets needed to underline the field, never fewer than one.
   *
   * @return the underline width
   */
  public int length() {
    return Math.max(1, end - start);
  }
}
