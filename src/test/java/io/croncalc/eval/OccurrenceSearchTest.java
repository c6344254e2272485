package io.croncalc.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.croncalc.CronException;
import io.croncalc.ast.ScheduleData;
import io.croncalc.field.FieldKind;
import io.croncalc.field.FieldSet;
import io.croncalc.parser.ExpressionParser;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Unit tests for OccurrenceSearch. */
public class OccurrenceSearchTest {

  private static LocalDateTime next(String expr, LocalDateTime start) throws CronException {
    return OccurrenceSearch.nextFire(
        ExpressionParser.parse(expr), start, OccurrenceSearch.DEFAULT_END);
  }

  private static LocalDateTime at(int year, int month, int day, int hour, int minute, int second) {
    return LocalDateTime.of(year, month, day, hour, minute, second);
  }

  private static LocalDateTime date(int year, int month, int day) {
    return LocalDateTime.of(year, month, day, 0, 0);
  }

  @Test
  void testDailyAtNoon() throws CronException {
    assertEquals(at(2024, 1, 1, 12, 0, 0), next("0 12 * * *", date(2024, 1, 1)));
  }

  @Test
  void testYearlyRollsIntoNextYear() throws CronException {
    assertEquals(date(2025, 1, 1), next("0 0 1 1 *", date(2024, 6, 1)));
  }

  @Test
  void testFebruaryThirtiethNeverOccurs() throws CronException {
    ScheduleData data = ExpressionParser.parse("* * 30 2 *");
    LocalDateTime end = date(2030, 1, 1);
    assertSame(end, OccurrenceSearch.nextFire(data, date(2024, 1, 1), end));
  }

  @Test
  void testThirtyFirstInThirtyDayMonthsNeverOccurs() throws CronException {
    ScheduleData data = ExpressionParser.parse("0 0 31 4,6,9,11 *");
    assertEquals(
        OccurrenceSearch.DEFAULT_END,
        OccurrenceSearch.nextFire(data, date(2024, 1, 1), OccurrenceSearch.DEFAULT_END));
    assertTrue(OccurrenceSearch.nextFrom(data, date(2024, 1, 1)).isEmpty());
  }

  @Test
  void testDayOfWeekSkipsToNextAllowedDay() throws CronException {
    // 2024-01-03 is a Wednesday; the next Sunday or Tuesday is Sunday 2024-01-07.
    LocalDateTime result = next("10 0-8/2 * * SUN,TUE", date(2024, 1, 3));
    assertEquals(at(2024, 1, 7, 0, 10, 0), result);
    assertEquals(DayOfWeek.SUNDAY, result.getDayOfWeek());
  }

  @Test
  void testWeekdaysSkipWeekend() throws CronException {
    // Friday 10:00 -> Monday 09:30
    assertEquals(at(2024, 1, 8, 9, 30, 0), next("30 9 * * Mon-Fri", at(2024, 1, 5, 10, 0, 0)));
  }

  @Test
  void testResultIsStrictlyAfterStart() throws CronException {
    assertEquals(at(2024, 1, 2, 12, 0, 0), next("0 0 12 * * *", at(2024, 1, 1, 12, 0, 0)));
  }

  @Test
  void testSubSecondStartAdvancesToNextSecond() throws CronException {
    LocalDateTime start = at(2024, 1, 1, 12, 0, 0).plusNanos(500_000_000);
    assertEquals(at(2024, 1, 1, 12, 0, 1), next("* * * * * *", start));
  }

  @Test
  void testLowerFieldsRestartWhenMinuteAdvances() throws CronException {
    assertEquals(at(2024, 1, 1, 10, 40, 0), next("* 40 * * * *", at(2024, 1, 1, 10, 30, 45)));
  }

  @Test
  void testLowerFieldsRestartWhenHourAdvances() throws CronException {
    assertEquals(at(2024, 1, 1, 12, 0, 0), next("* * 12 * * *", at(2024, 1, 1, 10, 30, 45)));
  }

  @Test
  void testSecondsCarryAcrossMidnight() throws CronException {
    assertEquals(date(2024, 1, 2), next("*/15 * * * * *", at(2024, 1, 1, 23, 59, 50)));
  }

  @Test
  void testCarryAcrossYearEnd() throws CronException {
    assertEquals(date(2025, 1, 1), next("0 0 0 1 1 *", at(2024, 12, 31, 23, 59, 59)));
  }

  @Test
  void testCarryAcrossMonthEnd() throws CronException {
    assertEquals(date(2024, 2, 1), next("0 0 0 * * *", at(2024, 1, 31, 12, 0, 0)));
  }

  @Test
  void testLastSecondOfYear() throws CronException {
    assertEquals(at(2024, 12, 31, 23, 59, 59), next("59 59 23 31 12 *", date(2024, 6, 1)));
  }

  @Test
  void testThirtyFirstSkipsShortMonth() throws CronException {
    assertEquals(date(2024, 5, 31), next("0 0 31 * *", date(2024, 4, 1)));
  }

  @Test
  void testLeapDay() throws CronException {
    assertEquals(date(2028, 2, 29), next("0 0 0 29 2 *", date(2024, 3, 1)));
  }

  @Test
  void testLeapDayOnMonday() throws CronException {
    assertEquals(date(2044, 2, 29), next("0 0 0 29 2 1", date(2024, 3, 1)));
  }

  @Test
  void testFridayTheThirteenth() throws CronException {
    assertEquals(date(2024, 9, 13), next("0 0 0 13 * 5", date(2024, 1, 1)));
  }

  @Test
  void testSaturdayWindowRollsToNextWeek() throws CronException {
    assertEquals(at(2024, 1, 13, 9, 0, 0), next("0 */20 9-17 * * Sat", at(2024, 1, 6, 17, 40, 1)));
  }

  @Test
  void testImpossibleDateBeforeEndReturnsEnd() throws CronException {
    ScheduleData data = ExpressionParser.parse("0 0 29 2 *");
    LocalDateTime end = date(2027, 12, 31);
    assertEquals(end, OccurrenceSearch.nextFire(data, date(2025, 1, 1), end));
  }

  @Test
  void testCandidateAtEndReturnsEnd() throws CronException {
    ScheduleData data = ExpressionParser.parse("0 12 * * *");
    LocalDateTime end = at(2024, 1, 1, 12, 0, 0);
    assertSame(end, OccurrenceSearch.nextFire(data, date(2024, 1, 1), end));
  }

  @Test
  void testStartAtOrAfterEndReturnsEnd() throws CronException {
    ScheduleData data = ExpressionParser.parse("* * * * * *");
    LocalDateTime end = date(2024, 1, 1);
    assertSame(end, OccurrenceSearch.nextFire(data, end, end));
    assertSame(end, OccurrenceSearch.nextFire(data, date(2024, 2, 1), end));
  }

  @Test
  void testEmptyFieldNeverMatches() {
    ScheduleData data =
        ScheduleData.of(
            FieldSet.of(FieldKind.SECOND, 0),
            FieldSet.of(FieldKind.MINUTE, 0),
            FieldSet.of(FieldKind.HOUR, 0),
            FieldSet.of(FieldKind.DAY_OF_MONTH, 1),
            FieldSet.of(FieldKind.MONTH, 1),
            FieldSet.of(FieldKind.DAY_OF_WEEK));
    LocalDateTime end = date(2030, 1, 1);
    assertEquals(end, OccurrenceSearch.nextFire(data, date(2024, 1, 1), end));
  }

  @Test
  void testYearCarryPastMaximumReturnsEnd() throws CronException {
    ScheduleData data = ExpressionParser.parse("0 0 1 1 *");
    LocalDateTime start = LocalDateTime.of(999_999_999, 6, 1, 0, 0);
    assertEquals(LocalDateTime.MAX, OccurrenceSearch.nextFire(data, start, LocalDateTime.MAX));
  }

  @Test
  void testStartInLastRepresentableSecondReturnsEnd() throws CronException {
    ScheduleData data = ExpressionParser.parse("* * * * * *");
    LocalDateTime start = LocalDateTime.MAX.minusNanos(1);
    assertEquals(LocalDateTime.MAX, OccurrenceSearch.nextFire(data, start, LocalDateTime.MAX));
  }

  @Test
  void testDayOfWeekRetryOnLastRepresentableDateReturnsEnd() throws CronException {
    // 999999999-12-31 is a Friday, so a Saturday-only schedule rejects it.
    LocalDateTime lastDay = LocalDateTime.of(999_999_999, 12, 31, 0, 0);
    assertEquals(DayOfWeek.FRIDAY, lastDay.getDayOfWeek());
    ScheduleData data = ExpressionParser.parse("0 0 31 12 Sat");
    assertEquals(
        LocalDateTime.MAX,
        OccurrenceSearch.nextFire(data, lastDay.minusDays(1), LocalDateTime.MAX));
  }

  @Test
  void testLastSecondBeforeDefaultEndFires() throws CronException {
    assertEquals(
        LocalDateTime.of(9999, 12, 31, 23, 59, 59), next("59 59 23 31 12 *", date(9999, 12, 1)));
  }

  @Test
  void testNextFrom() throws CronException {
    ScheduleData data = ExpressionParser.parse("0 12 * * *");
    assertEquals(Optional.of(at(2024, 1, 1, 12, 0, 0)), OccurrenceSearch.nextFrom(data, date(2024, 1, 1)));
  }

  @Test
  void testNextNFrom() throws CronException {
    ScheduleData data = ExpressionParser.parse("0 0 1 */4 *");
    List<LocalDateTime> results = OccurrenceSearch.nextNFrom(data, date(2024, 2, 15), 4);
    assertEquals(
        List.of(date(2024, 5, 1), date(2024, 9, 1), date(2025, 1, 1), date(2025, 5, 1)), results);
  }

  @Test
  void testFedBackResultsAreIncreasingAndMatch() throws CronException {
    ScheduleData data = ExpressionParser.parse("*/20 */7 1-3 * * Mon,Thu");
    LocalDateTime current = at(2024, 2, 27, 3, 50, 17);
    for (int i = 0; i < 200; i++) {
      LocalDateTime next = OccurrenceSearch.nextFire(data, current, OccurrenceSearch.DEFAULT_END);
      assertTrue(next.isAfter(current), "not after " + current + ": " + next);
      assertTrue(OccurrenceSearch.matches(data, next), "does not match: " + next);
      current = next;
    }
  }

  @Test
  void testNoMatchSkippedBetweenConsecutiveResults() throws CronException {
    ScheduleData data = ExpressionParser.parse("0 */30 * * * *");
    LocalDateTime current = date(2024, 2, 28);
    for (int i = 0; i < 100; i++) {
      LocalDateTime next = OccurrenceSearch.nextFire(data, current, OccurrenceSearch.DEFAULT_END);
      assertEquals(current.plusMinutes(30), next);
      current = next;
    }
  }

  @Test
  void testMatches() throws CronException {
    ScheduleData data = ExpressionParser.parse("10 0-8/2 * * SUN,TUE");
    assertTrue(OccurrenceSearch.matches(data, at(2024, 1, 7, 4, 10, 0)));
    assertFalse(OccurrenceSearch.matches(data, at(2024, 1, 7, 3, 10, 0)));
    assertFalse(OccurrenceSearch.matches(data, at(2024, 1, 8, 4, 10, 0)));
    assertFalse(OccurrenceSearch.matches(data, at(2024, 1, 7, 4, 10, 1)));
  }
}
