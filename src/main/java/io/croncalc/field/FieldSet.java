package io.croncalc.field;

import io.croncalc.CronException;
import io.croncalc.display.Display;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.OptionalInt;

/**
 * The set of values one schedule field allows, stored as a bit vector over the field's domain.
 *
 * <p>A FieldSet is built from a single field token such as {@code "*"}, {@code "0-8/2"} or {@code
 * "SUN,TUE"}. The token is a comma-separated list of elements, each of which is one of:
 *
 * <ul>
 *   <li>{@code *} or {@code *&#47;n}: the whole domain, or every n-th value from the minimum
 *   <li>{@code a-b} or {@code a-b/n}: an inclusive range, swapped if {@code a > b}
 *   <li>{@code a}: a single value
 *   <li>{@code a/0}: every value from {@code a} through the maximum
 * </ul>
 *
 * <p>Values are numbers or, for fields that have names, case-insensitive name prefixes. The first
 * name in list order that starts with the given text wins.
 *
 * <p>Instances are immutable. The tightest bounds enclosing the members ({@link #minValueSet()},
 * {@link #maxValueSet()}) are kept to shorten successor scans.
 */
public final class FieldSet {
  private final int minValue;
  private final int maxValue;
  private final BitSet bits;
  private final int minValueSet;
  private final int maxValueSet;

  private FieldSet(int minValue, int maxValue, BitSet bits, int minValueSet, int maxValueSet) {
    this.minValue = minValue;
    this.maxValue = maxValue;
    this.bits = bits;
    this.minValueSet = minValueSet;
    this.maxValueSet = maxValueSet;
  }

  /**
   * Parses a field token against the domain of the given field kind.
   *
   * @param token the field token
   * @param kind the field kind supplying the domain and names
   * @return the parsed field set
   * @throws CronException if the token is invalid for this field
   */
  public static FieldSet parse(String token, FieldKind kind) throws CronException {
    return parse(token, kind.minValue(), kind.maxValue(), kind.names());
  }

  /**
   * Parses a field token against an explicit domain.
   *
   * @param token the field token
   * @param minValue the smallest value of the domain
   * @param maxValue the largest value of the domain
   * @param names symbolic names, where index {@code i} denotes {@code minValue + i}; may be empty
   * @return the parsed field set
   * @throws CronException if the token is invalid for this domain
   */
  public static FieldSet parse(String token, int minValue, int maxValue, List<String> names)
      throws CronException {
    if (minValue > maxValue) {
      throw new IllegalArgumentException("empty domain [" + minValue + ", " + maxValue + "]");
    }
    Accumulator acc = new Accumulator(minValue, maxValue, names == null ? List.of() : names);
    acc.parseToken(token);
    return acc.build();
  }

  /**
   * Creates a field set holding exactly the given values.
   *
   * @param kind the field kind supplying the domain
   * @param values the members, each within the domain
   * @return the field set
   */
  public static FieldSet of(FieldKind kind, int... values) {
    Accumulator acc = new Accumulator(kind.minValue(), kind.maxValue(), kind.names());
    for (int value : values) {
      if (value < kind.minValue() || value > kind.maxValue()) {
        throw new IllegalArgumentException(
            value + " is out of [" + kind.minValue() + ", " + kind.maxValue() + "]");
      }
      acc.accumulate(value, value, 1);
    }
    return acc.build();
  }

  /**
   * Returns the smallest member.
   *
   * @return the smallest member, or empty if the set has no members
   */
  public OptionalInt first() {
    return next(minValueSet);
  }

  /**
   * Returns the smallest member greater than or equal to {@code start}.
   *
   * @param start the lower bound (inclusive); may lie outside the domain
   * @return the member, or empty if no member is {@code >= start}
   */
  public OptionalInt next(int start) {
    int from = Math.max(start, minValueSet);
    if (from > maxValueSet) {
      return OptionalInt.empty();
    }
    int index = bits.nextSetBit(from - minValue);
    if (index < 0 || index + minValue > maxValueSet) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(index + minValue);
  }

  /**
   * Checks whether a value is a member.
   *
   * @param value the value to test
   * @return true if the value is allowed
   */
  public boolean contains(int value) {
    return value >= minValue && value <= maxValue && bits.get(value - minValue);
  }

  /**
   * Returns the smallest value of the domain.
   *
   * @return the domain minimum
   */
  public int minValue() {
    return minValue;
  }

  /**
   * Returns the largest value of the domain.
   *
   * @return the domain maximum
   */
  public int maxValue() {
    return maxValue;
  }

  /**
   * Returns the lower bound enclosing all members.
   *
   * @return the lower member bound; greater than {@link #maxValue()} when empty
   */
  public int minValueSet() {
    return minValueSet;
  }

  /**
   * Returns the upper bound enclosing all members.
   *
   * @return the upper member bound; less than {@link #minValue()} when empty
   */
  public int maxValueSet() {
    return maxValueSet;
  }

  /**
   * Returns the number of members.
   *
   * @return the member count
   */
  public int size() {
    return bits.cardinality();
  }

  /**
   * Checks whether every value of the domain is a member.
   *
   * @return true if the set equals the whole domain
   */
  public boolean isFull() {
    return size() == maxValue - minValue + 1;
  }

  /**
   * Returns the members in ascending order.
   *
   * @return the members
   */
  public List<Integer> values() {
    List<Integer> values = new ArrayList<>(size());
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      values.add(i + minValue);
    }
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldSet)) {
      return false;
    }
    FieldSet other = (FieldSet) o;
    return minValue == other.minValue && maxValue == other.maxValue && bits.equals(other.bits);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * minValue + maxValue) + bits.hashCode();
  }

  @Override
  public String toString() {
    return Display.renderField(this);
  }

  /** Mutable state used while a token is being parsed. */
  private static final class Accumulator {
    private final int minValue;
    private final int maxValue;
    private final List<String> names;
    private final BitSet bits;
    private int minValueSet;
    private int maxValueSet;

    Accumulator(int minValue, int maxValue, List<String> names) {
      this.minValue = minValue;
      this.maxValue = maxValue;
      this.names = names;
      this.bits = new BitSet(maxValue - minValue + 1);
      this.minValueSet = maxValue + 1;
      this.maxValueSet = minValue - 1;
    }

    FieldSet build() {
      return new FieldSet(minValue, maxValue, (BitSet) bits.clone(), minValueSet, maxValueSet);
    }

    void parseToken(String token) throws CronException {
      if (token == null || token.isBlank()) {
        throw CronException.malformedToken("field token is empty", token == null ? "" : token);
      }
      if (token.indexOf(',') < 0) {
        parseElement(token, token);
        return;
      }
      for (String element : token.split(",", -1)) {
        parseElement(element, token);
      }
    }

    private void parseElement(String element, String token) throws CronException {
      if (element.isEmpty()) {
        throw CronException.malformedToken("empty list element in \"" + token + "\"", token);
      }

      int step = 1;
      String range = element;
      int slash = element.indexOf('/');
      if (slash == 0) {
        throw CronException.malformedToken(
            "\"" + element + "\" has a step but no value before it", token);
      }
      if (slash > 0) {
        step = parseStep(element.substring(slash + 1), token);
        range = element.substring(0, slash);
      }

      if (range.equals("*")) {
        accumulateAll(step);
        return;
      }

      int dash = range.indexOf('-');
      if (dash == 0) {
        throw CronException.malformedToken(
            "\"" + range + "\" has a range with no start value", token);
      }
      if (dash > 0) {
        int first = parseValue(range.substring(0, dash), token);
        int last = parseValue(range.substring(dash + 1), token);
        accumulate(Math.min(first, last), Math.max(first, last), step);
        return;
      }

      int value = parseValue(range, token);
      if (step == 1) {
        accumulate(value, value, 1);
        return;
      }
      // "a/0" is the only stepped single-value form: a through the domain maximum.
      if (step != 0) {
        throw CronException.malformedToken(
            "\"" + element + "\" has an invalid step; a single value only accepts /0 or /1",
            token);
      }
      accumulate(value, maxValue, 1);
    }

    private int parseStep(String text, String token) throws CronException {
      if (text.isEmpty() || !isAllDigits(text)) {
        throw CronException.malformedToken(
            "\"" + text + "\" is not a valid step in \"" + token + "\"", token);
      }
      try {
        return Integer.parseInt(text);
      } catch (NumberFormatException e) {
        throw CronException.malformedToken(
            "\"" + text + "\" is not a valid step in \"" + token + "\"", token);
      }
    }

    private int parseValue(String text, String token) throws CronException {
      if (text.isEmpty()) {
        throw CronException.malformedToken("missing value in \"" + token + "\"", token);
      }

      if (Character.isDigit(text.charAt(0))) {
        if (!isAllDigits(text)) {
          throw CronException.malformedToken(
              "\"" + text + "\" is not a valid numeric value in \"" + token + "\"", token);
        }
        int value;
        try {
          value = Integer.parseInt(text);
        } catch (NumberFormatException e) {
          throw CronException.malformedToken(
              "\"" + text + "\" is too large a value in \"" + token + "\"", token);
        }
        if (value < minValue || value > maxValue) {
          throw CronException.valueOutOfRange(value, minValue, maxValue, token);
        }
        return value;
      }

      if (names.isEmpty() || !Character.isLetter(text.charAt(0))) {
        throw CronException.malformedToken(
            "\""
                + text
                + "\" is not a valid field value; it must be a number between "
                + minValue
                + " and "
                + maxValue
                + (names.isEmpty() ? "" : " or a name"),
            token);
      }

      for (int i = 0; i < names.size(); i++) {
        String name = names.get(i);
        if (name.length() >= text.length() && name.regionMatches(true, 0, text, 0, text.length())) {
          return minValue + i;
        }
      }
      throw CronException.unknownName(text, names, token);
    }

    private void accumulateAll(int step) {
      if (step <= 1) {
        bits.set(0, maxValue - minValue + 1);
        minValueSet = minValue;
        maxValueSet = maxValue;
        return;
      }
      accumulate(minValue, maxValue, step);
    }

    void accumulate(int start, int end, int step) {
      if (step < 1) {
        step = 1;
      }
      int last = start;
      for (int v = start; v <= end; v += step) {
        bits.set(v - minValue);
        last = v;
      }
      minValueSet = Math.min(minValueSet, start);
      maxValueSet = Math.max(maxValueSet, last);
    }

    private static boolean isAllDigits(String text) {
      for (int i = 0; i < text.length(); i++) {
        char ch = text.charAt(i);
        if (ch < '0' || ch > '9') {
          return false;
        }
      }
      return true;
    }
  }
}
