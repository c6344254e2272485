package io.croncalc;

import io.croncalc.ast.ScheduleData;
import io.croncalc.display.Display;
import io.croncalc.eval.OccurrenceSearch;
import io.croncalc.field.FieldKind;
import io.croncalc.field.FieldSet;
import io.croncalc.parser.ExpressionParser;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A parsed schedule expression that can be queried for occurrences.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Schedule schedule = Schedule.parse("10 0-8/2 * * SUN,TUE");
 * LocalDateTime next = schedule.nextFire(LocalDateTime.now());
 * if (!next.equals(Schedule.DEFAULT_END)) {
 *     System.out.println("Next occurrence: " + next);
 * }
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class Schedule {
  /** End bound used when the caller supplies none. */
  public static final LocalDateTime DEFAULT_END = OccurrenceSearch.DEFAULT_END;

  private final ScheduleData data;

  private Schedule(ScheduleData data) {
    this.data = data;
  }

  /**
   * Parses a 5- or 6-field expression into a Schedule.
   *
   * @param expression the schedule expression
   * @return the parsed schedule
   * @throws CronException if the expression is invalid
   */
  public static Schedule parse(String expression) throws CronException {
    return new Schedule(ExpressionParser.parse(expression));
  }

  /**
   * Wraps already parsed schedule data.
   *
   * @param data the schedule data
   * @return the schedule
   */
  public static Schedule of(ScheduleData data) {
    return new Schedule(data);
  }

  /**
   * Validates an expression without throwing.
   *
   * @param expression the schedule expression
   * @return true if the expression is valid
   */
  public static boolean validate(String expression) {
    try {
      ExpressionParser.parse(expression);
      return true;
    } catch (CronException e) {
      return false;
    }
  }

  /**
   * Computes the earliest occurrence strictly between {@code start} and {@code end}.
   *
   * @param start the search start (exclusive)
   * @param end the search end (exclusive)
   * @return the next occurrence, or {@code end} if none exists before it
   */
  public LocalDateTime nextFire(LocalDateTime start, LocalDateTime end) {
    return OccurrenceSearch.nextFire(data, start, end);
  }

  /**
   * Computes the earliest occurrence after {@code start}, bounded by {@link #DEFAULT_END}.
   *
   * @param start the search start (exclusive)
   * @return the next occurrence, or {@link #DEFAULT_END} if none exists
   */
  public LocalDateTime nextFire(LocalDateTime start) {
    return OccurrenceSearch.nextFire(data, start, DEFAULT_END);
  }

  /**
   * Computes the next occurrence after the given time.
   *
   * @param start the reference time (exclusive)
   * @return the next occurrence, or empty if none exists
   */
  public Optional<LocalDateTime> nextFrom(LocalDateTime start) {
    return OccurrenceSearch.nextFrom(data, start);
  }

  /**
   * Computes the next n occurrences after the given time.
   *
   * @param start the reference time (exclusive)
   * @param n the number of occurrences to compute
   * @return a list of up to n occurrences
   */
  public List<LocalDateTime> nextNFrom(LocalDateTime start, int n) {
    return OccurrenceSearch.nextNFrom(data, start, n);
  }

  /**
   * Checks if a datetime matches this schedule.
   *
   * @param datetime the datetime to check
   * @return true if the datetime matches
   */
  public boolean matches(LocalDateTime datetime) {
    return OccurrenceSearch.matches(data, datetime);
  }

  /**
   * Returns a lazy stream of occurrences starting after the given time.
   *
   * @param from the reference time (exclusive)
   * @return a stream of occurrences
   */
  public Stream<LocalDateTime> occurrences(LocalDateTime from) {
    return OccurrenceSearch.occurrences(data, from);
  }

  /**
   * Returns a lazy stream of occurrences where from &lt; occurrence &lt; to.
   *
   * @param from the start time (exclusive)
   * @param to the end time (exclusive)
   * @return a stream of occurrences in the range
   */
  public Stream<LocalDateTime> between(LocalDateTime from, LocalDateTime to) {
    return OccurrenceSearch.between(data, from, to);
  }

  /**
   * Returns the parsed values of one field.
   *
   * @param kind the field kind
   * @return the field set
   */
  public FieldSet field(FieldKind kind) {
    return data.field(kind);
  }

  /**
   * Returns the underlying schedule data.
   *
   * @return the schedule data
   */
  public ScheduleData data() {
    return data;
  }

  /**
   * Returns the canonical six-field representation of this schedule.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(data);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Schedule && data.equals(((Schedule) o).data));
  }

  @Override
  public int hashCode() {
    return data.hashCode();
  }
}
