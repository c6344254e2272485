package io.croncalc.field;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Represents a day of the week, numbered the way cron numbers them (Sunday=0). */
public enum Weekday {
  SUNDAY(0, "Sunday"),
  MONDAY(1, "Monday"),
  TUESDAY(2, "Tuesday"),
  WEDNESDAY(3, "Wednesday"),
  THURSDAY(4, "Thursday"),
  FRIDAY(5, "Friday"),
  SATURDAY(6, "Saturday");

  private static final List<String> NAMES =
      Arrays.stream(values()).map(Weekday::toString).toList();

  private final int cronNumber;
  private final String displayName;

  Weekday(int cronNumber, String displayName) {
    this.cronNumber = cronNumber;
    this.displayName = displayName;
  }

  /**
   * Returns the cron day of week number (Sunday=0, Monday=1, ..., Saturday=6).
   *
   * @return the cron day of week number
   */
  public int number() {
    return cronNumber;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Returns the full weekday names in cron order, starting with Sunday.
   *
   * @return the weekday names
   */
  public static List<String> names() {
    return NAMES;
  }

  /**
   * Returns a Weekday from a cron day of week number.
   *
   * @param n the cron day number (0-6)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromNumber(int n) {
    if (n < 0 || n > 6) {
      return Optional.empty();
    }
    return Optional.of(values()[n]);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.getValue() % 7];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public DayOfWeek toDayOfWeek() {
    return cronNumber == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(cronNumber);
  }
}
