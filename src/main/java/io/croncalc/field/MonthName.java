package io.croncalc.field;

import java.time.Month;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Represents a month of the year. */
public enum MonthName {
  JANUARY(1, "January"),
  FEBRUARY(2, "February"),
  MARCH(3, "March"),
  APRIL(4, "April"),
  MAY(5, "May"),
  JUNE(6, "June"),
  JULY(7, "July"),
  AUGUST(8, "August"),
  SEPTEMBER(9, "September"),
  OCTOBER(10, "October"),
  NOVEMBER(11, "November"),
  DECEMBER(12, "December");

  private static final List<String> NAMES =
      Arrays.stream(values()).map(MonthName::toString).toList();

  private final int monthNumber;
  private final String displayName;

  MonthName(int monthNumber, String displayName) {
    this.monthNumber = monthNumber;
    this.displayName = displayName;
  }

  /**
   * Returns the month number (January=1, December=12).
   *
   * @return the month number
   */
  public int number() {
    return monthNumber;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Returns the full month names in calendar order.
   *
   * @return the month names
   */
  public static List<String> names() {
    return NAMES;
  }

  /**
   * Returns a MonthName from a month number.
   *
   * @param n the month number (1-12)
   * @return the month if valid
   */
  public static Optional<MonthName> fromNumber(int n) {
    if (n < 1 || n > 12) {
      return Optional.empty();
    }
    return Optional.of(values()[n - 1]);
  }

  /**
   * Returns the longest length this month can have in any year (February=29).
   *
   * @return the maximum number of days
   */
  public int maxLength() {
    return toMonth().maxLength();
  }

  /**
   * Converts this MonthName to a java.time.Month.
   *
   * @return the corresponding Month
   */
  public Month toMonth() {
    return Month.of(monthNumber);
  }
}
