package io.croncalc.ast;

import io.croncalc.field.FieldKind;
import io.croncalc.field.FieldSet;
import java.util.Arrays;
import java.util.Objects;

/**
 * Represents a parsed schedule: one field set per {@link FieldKind}.
 *
 * <p>Slots are indexed by {@link FieldKind#ordinal()}, so every instance holds exactly six field
 * sets. Instances are immutable.
 */
public final class ScheduleData {
  private final FieldSet[] fields;

  private ScheduleData(FieldSet[] fields) {
    this.fields = fields;
  }

  /**
   * Creates schedule data from six field sets.
   *
   * @param second the seconds field
   * @param minute the minutes field
   * @param hour the hours field
   * @param dayOfMonth the day-of-month field
   * @param month the month field
   * @param dayOfWeek the day-of-week field
   * @return a new ScheduleData
   */
  public static ScheduleData of(
      FieldSet second,
      FieldSet minute,
      FieldSet hour,
      FieldSet dayOfMonth,
      FieldSet month,
      FieldSet dayOfWeek) {
    return of(new FieldSet[] {second, minute, hour, dayOfMonth, month, dayOfWeek});
  }

  /**
   * Creates schedule data from an array indexed by {@link FieldKind#ordinal()}.
   *
   * @param fields the six field sets
   * @return a new ScheduleData
   */
  public static ScheduleData of(FieldSet[] fields) {
    FieldKind[] kinds = FieldKind.values();
    if (fields.length != kinds.length) {
      throw new IllegalArgumentException(
          "expected " + kinds.length + " fields, got " + fields.length);
    }
    for (FieldKind kind : kinds) {
      FieldSet field = Objects.requireNonNull(fields[kind.ordinal()], kind + " field");
      if (field.minValue() != kind.minValue() || field.maxValue() != kind.maxValue()) {
        throw new IllegalArgumentException(
            kind + " field has domain [" + field.minValue() + ", " + field.maxValue() + "]");
      }
    }
    return new ScheduleData(fields.clone());
  }

  /**
   * Returns the field set for a field kind.
   *
   * @param kind the field kind
   * @return the field set
   */
  public FieldSet field(FieldKind kind) {
    return fields[kind.ordinal()];
  }

  public FieldSet second() {
    return fields[FieldKind.SECOND.ordinal()];
  }

  public FieldSet minute() {
    return fields[FieldKind.MINUTE.ordinal()];
  }

  public FieldSet hour() {
    return fields[FieldKind.HOUR.ordinal()];
  }

  public FieldSet dayOfMonth() {
    return fields[FieldKind.DAY_OF_MONTH.ordinal()];
  }

  public FieldSet month() {
    return fields[FieldKind.MONTH.ordinal()];
  }

  public FieldSet dayOfWeek() {
    return fields[FieldKind.DAY_OF_WEEK.ordinal()];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof ScheduleData && Arrays.equals(fields, ((ScheduleData) o).fields);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(fields);
  }
}
