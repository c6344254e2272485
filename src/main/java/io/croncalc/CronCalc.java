package io.croncalc;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One-shot entry points: parse an expression and compute its next occurrence.
 *
 * <p>Every call parses a fresh {@link Schedule}. Callers that query the same expression repeatedly
 * should parse it once with {@link Schedule#parse(String)} instead.
 */
public final class CronCalc {
  private CronCalc() {}

  /**
   * Computes the next occurrence after the current time of the system default clock.
   *
   * @param expression the schedule expression
   * @return the next occurrence, or {@link Schedule#DEFAULT_END} if none exists
   * @throws CronException if the expression is invalid
   */
  public static LocalDateTime nextFire(String expression) throws CronException {
    return nextFire(expression, Clock.systemDefaultZone());
  }

  /**
   * Computes the next occurrence after the current time of the given clock.
   *
   * @param expression the schedule expression
   * @param clock the clock supplying the start time
   * @return the next occurrence, or {@link Schedule#DEFAULT_END} if none exists
   * @throws CronException if the expression is invalid
   */
  public static LocalDateTime nextFire(String expression, Clock clock) throws CronException {
    Objects.requireNonNull(clock, "clock");
    Schedule schedule = Schedule.parse(expression);
    return schedule.nextFire(LocalDateTime.now(clock), Schedule.DEFAULT_END);
  }

  /**
   * Computes the next occurrence after {@code start}.
   *
   * @param expression the schedule expression
   * @param start the search start (exclusive)
   * @return the next occurrence, or {@link Schedule#DEFAULT_END} if none exists
   * @throws CronException if the expression is invalid
   */
  public static LocalDateTime nextFire(String expression, LocalDateTime start)
      throws CronException {
    return nextFire(expression, start, Schedule.DEFAULT_END);
  }

  /**
   * Computes the next occurrence strictly between {@code start} and {@code end}.
   *
   * @param expression the schedule expression
   * @param start the search start (exclusive)
   * @param end the search end (exclusive), returned when no occurrence exists before it
   * @return the next occurrence, or {@code end}
   * @throws CronException if the expression is invalid
   */
  public static LocalDateTime nextFire(String expression, LocalDateTime start, LocalDateTime end)
      throws CronException {
    return Schedule.parse(expression).nextFire(start, end);
  }
}
