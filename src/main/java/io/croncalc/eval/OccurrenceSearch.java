package io.croncalc.eval;

import io.croncalc.ast.ScheduleData;
import io.croncalc.field.FieldSet;
import io.croncalc.field.MonthName;
import io.croncalc.field.Weekday;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the next instant matching a parsed schedule.
 *
 * <h2>Search</h2>
 *
 * <p>The search keeps an inclusive floor, initially one second after the start. Each pass resolves
 * the calendar fields from the floor upwards: second, minute, hour, then day, month and year. A
 * field with no allowed value at or after its current position takes its first allowed value and
 * carries one into the next field. Whenever a field lands later than the floor's value, every lower
 * field restarts at its first allowed value.
 *
 * <p>Day and month constrain each other (the 31st does not exist in April), so they are resolved in
 * a loop: a day past the end of its month counts as exhausted and carries into the month. If such a
 * date already lies at or past the end bound, the search stops.
 *
 * <p>Day-of-week is checked last. A candidate on a disallowed weekday moves the floor to the start
 * of the following day and the pass repeats.
 *
 * <h2>End bound</h2>
 *
 * <p>The end instant is exclusive and doubles as the "no occurrence" result: callers compare the
 * returned value with the end they supplied.
 */
public final class OccurrenceSearch {
  private static final Logger logger = LoggerFactory.getLogger(OccurrenceSearch.class);

  /** End bound used when the caller supplies none. */
  public static final LocalDateTime DEFAULT_END =
      LocalDateTime.of(9999, 12, 31, 23, 59, 59, 999_999_999);

  private static final LocalDateTime LAST_SECOND =
      LocalDateTime.MAX.truncatedTo(ChronoUnit.SECONDS);

  private OccurrenceSearch() {}

  /**
   * Computes the earliest instant strictly after {@code start} and strictly before {@code end} that
   * matches every field of the schedule.
   *
   * @param data the schedule data
   * @param start the search start (exclusive)
   * @param end the search end (exclusive)
   * @return the next occurrence, or {@code end} if none exists before it
   */
  public static LocalDateTime nextFire(ScheduleData data, LocalDateTime start, LocalDateTime end) {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");

    if (!start.isBefore(end)) {
      return end;
    }
    if (!hasPossibleDate(data)) {
      logger.debug("Schedule allows no calendar date, returning end bound {}", end);
      return end;
    }

    LocalDateTime truncated = start.truncatedTo(ChronoUnit.SECONDS);
    if (truncated.equals(LAST_SECOND)) {
      return end;
    }

    LocalDate endDate = end.toLocalDate();
    LocalDateTime floor = truncated.plusSeconds(1);
    while (true) {
      Optional<LocalDateTime> candidate = candidateFrom(data, floor, endDate);
      if (candidate.isEmpty() || !candidate.get().isBefore(end)) {
        logger.debug("No occurrence after {} before end bound {}", start, end);
        return end;
      }

      LocalDateTime t = candidate.get();
      if (data.dayOfWeek().contains(Weekday.fromDayOfWeek(t.getDayOfWeek()).number())) {
        return t;
      }
      logger.trace("Candidate {} falls on a disallowed {}", t, t.getDayOfWeek());
      if (t.toLocalDate().equals(LocalDate.MAX)) {
        return end;
      }
      floor = startOfNextDay(t);
    }
  }

  /**
   * Computes the next occurrence after the given time.
   *
   * @param data the schedule data
   * @param start the reference time (exclusive)
   * @return the next occurrence, or empty if none exists before {@link #DEFAULT_END}
   */
  public static Optional<LocalDateTime> nextFrom(ScheduleData data, LocalDateTime start) {
    LocalDateTime next = nextFire(data, start, DEFAULT_END);
    return next.equals(DEFAULT_END) ? Optional.empty() : Optional.of(next);
  }

  /**
   * Computes the next n occurrences after the given time, feeding each result back as the next
   * start.
   *
   * @param data the schedule data
   * @param start the reference time (exclusive)
   * @param n the number of occurrences to compute
   * @return up to n occurrences in increasing order
   */
  public static List<LocalDateTime> nextNFrom(ScheduleData data, LocalDateTime start, int n) {
    List<LocalDateTime> results = new ArrayList<>(Math.max(n, 0));
    LocalDateTime current = start;

    for (int i = 0; i < n; i++) {
      Optional<LocalDateTime> next = nextFrom(data, current);
      if (next.isEmpty()) {
        break;
      }
      results.add(next.get());
      current = next.get();
    }

    return results;
  }

  /**
   * Returns a lazy stream of occurrences after the given time.
   *
   * @param data the schedule data
   * @param from the reference time (exclusive)
   * @return a stream of occurrences
   */
  public static Stream<LocalDateTime> occurrences(ScheduleData data, LocalDateTime from) {
    return between(data, from, DEFAULT_END);
  }

  /**
   * Returns a lazy stream of occurrences where from &lt; occurrence &lt; to.
   *
   * @param data the schedule data
   * @param from the start time (exclusive)
   * @param to the end time (exclusive)
   * @return a stream of occurrences in the range
   */
  public static Stream<LocalDateTime> between(
      ScheduleData data, LocalDateTime from, LocalDateTime to) {
    Iterator<LocalDateTime> iterator =
        new Iterator<>() {
          private LocalDateTime current = from;
          private LocalDateTime next = null;
          private boolean hasNext = false;
          private boolean computed = false;

          private void computeNext() {
            if (!computed) {
              LocalDateTime result = nextFire(data, current, to);
              if (result.equals(to)) {
                hasNext = false;
              } else {
                next = result;
                current = result;
                hasNext = true;
              }
              computed = true;
            }
          }

          @Override
          public boolean hasNext() {
            computeNext();
            return hasNext;
          }

          @Override
          public LocalDateTime next() {
            computeNext();
            if (!hasNext) {
              throw new NoSuchElementException();
            }
            computed = false;
            return next;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Checks if a datetime matches every field of the schedule. Sub-second precision is ignored.
   *
   * @param data the schedule data
   * @param dt the datetime to check
   * @return true if the datetime matches
   */
  public static boolean matches(ScheduleData data, LocalDateTime dt) {
    return data.second().contains(dt.getSecond())
        && data.minute().contains(dt.getMinute())
        && data.hour().contains(dt.getHour())
        && data.dayOfMonth().contains(dt.getDayOfMonth())
        && data.month().contains(dt.getMonthValue())
        && data.dayOfWeek().contains(Weekday.fromDayOfWeek(dt.getDayOfWeek()).number());
  }

  /**
   * Resolves second through year from an inclusive floor, ignoring day-of-week.
   *
   * @return the candidate, or empty if only impossible dates remain before the end date
   */
  private static Optional<LocalDateTime> candidateFrom(
      ScheduleData data, LocalDateTime floor, LocalDate endDate) {
    FieldSet seconds = data.second();
    FieldSet minutes = data.minute();
    FieldSet hours = data.hour();
    FieldSet days = data.dayOfMonth();
    FieldSet months = data.month();

    int firstSecond = seconds.first().getAsInt();
    int firstMinute = minutes.first().getAsInt();
    int firstHour = hours.first().getAsInt();
    int firstDay = days.first().getAsInt();
    int firstMonth = months.first().getAsInt();

    int baseYear = floor.getYear();
    int baseMonth = floor.getMonthValue();
    int baseDay = floor.getDayOfMonth();
    int baseHour = floor.getHour();
    int baseMinute = floor.getMinute();

    int year = baseYear;
    int month = baseMonth;
    int day = baseDay;
    int hour = baseHour;
    int minute = baseMinute;
    int second;

    OptionalInt next = seconds.next(floor.getSecond());
    if (next.isPresent()) {
      second = next.getAsInt();
    } else {
      second = firstSecond;
      minute++;
    }

    next = minutes.next(minute);
    if (next.isPresent()) {
      minute = next.getAsInt();
      if (minute > baseMinute) {
        second = firstSecond;
      }
    } else {
      second = firstSecond;
      minute = firstMinute;
      hour++;
    }

    next = hours.next(hour);
    if (next.isPresent()) {
      hour = next.getAsInt();
      if (hour > baseHour) {
        second = firstSecond;
        minute = firstMinute;
      }
    } else {
      second = firstSecond;
      minute = firstMinute;
      hour = firstHour;
      day++;
    }

    next = days.next(day);
    while (true) {
      if (next.isPresent()) {
        day = next.getAsInt();
        if (day > baseDay) {
          second = firstSecond;
          minute = firstMinute;
          hour = firstHour;
        }
      } else {
        second = firstSecond;
        minute = firstMinute;
        hour = firstHour;
        day = firstDay;
        month++;
      }

      OptionalInt nextMonth = months.next(month);
      if (nextMonth.isPresent()) {
        month = nextMonth.getAsInt();
        if (month > baseMonth) {
          second = firstSecond;
          minute = firstMinute;
          hour = firstHour;
          day = firstDay;
        }
      } else {
        second = firstSecond;
        minute = firstMinute;
        hour = firstHour;
        day = firstDay;
        month = firstMonth;
        year++;
      }

      if (year > Year.MAX_VALUE) {
        return Optional.empty();
      }

      boolean dateChanged = year != baseYear || month != baseMonth || day != baseDay;
      if (dateChanged && day > YearMonth.of(year, month).lengthOfMonth()) {
        if (isOnOrAfter(year, month, day, endDate)) {
          return Optional.empty();
        }
        // Every later day in the set is invalid too; move on to the next month.
        next = OptionalInt.empty();
        continue;
      }
      break;
    }

    return Optional.of(LocalDateTime.of(year, month, day, hour, minute, second));
  }

  /** Checks whether any allowed month has room for the smallest allowed day-of-month. */
  private static boolean hasPossibleDate(ScheduleData data) {
    if (data.second().first().isEmpty()
        || data.minute().first().isEmpty()
        || data.hour().first().isEmpty()
        || data.dayOfWeek().first().isEmpty()) {
      return false;
    }
    OptionalInt firstDay = data.dayOfMonth().first();
    if (firstDay.isEmpty()) {
      return false;
    }
    for (int month : data.month().values()) {
      if (firstDay.getAsInt() <= MonthName.fromNumber(month).orElseThrow().maxLength()) {
        return true;
      }
    }
    return false;
  }

  private static boolean isOnOrAfter(int year, int month, int day, LocalDate date) {
    if (year != date.getYear()) {
      return year > date.getYear();
    }
    if (month != date.getMonthValue()) {
      return month > date.getMonthValue();
    }
    return day >= date.getDayOfMonth();
  }

  private static LocalDateTime startOfNextDay(LocalDateTime t) {
    return t.toLocalDate().plusDays(1).atStartOfDay();
  }
}
