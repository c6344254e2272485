package io.croncalc.field;

import java.util.List;

/** The six fields of a schedule expression, in left-to-right order. */
public enum FieldKind {
  SECOND("second", 0, 59, List.of()),
  MINUTE("minute", 0, 59, List.of()),
  HOUR("hour", 0, 23, List.of()),
  DAY_OF_MONTH("day-of-month", 1, 31, List.of()),
  MONTH("month", 1, 12, MonthName.names()),
  DAY_OF_WEEK("day-of-week", 0, 6, Weekday.names());

  private final String displayName;
  private final int minValue;
  private final int maxValue;
  private final List<String> names;

  FieldKind(String displayName, int minValue, int maxValue, List<String> names) {
    this.displayName = displayName;
    this.minValue = minValue;
    this.maxValue = maxValue;
    this.names = names;
  }

  /**
   * Returns the smallest value of this field's domain.
   *
   * @return the minimum value
   */
  public int minValue() {
    return minValue;
  }

  /**
   * Returns the largest value of this field's domain.
   *
   * @return the maximum value
   */
  public int maxValue() {
    return maxValue;
  }

  /**
   * Returns the symbolic names accepted by this field, where the name at index {@code i} denotes
   * {@code minValue() + i}. Empty for numeric-only fields.
   *
   * @return the names
   */
  public List<String> names() {
    return names;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
