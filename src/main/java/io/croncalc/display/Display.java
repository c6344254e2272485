package io.croncalc.display;

import io.croncalc.ast.ScheduleData;
import io.croncalc.field.FieldKind;
import io.croncalc.field.FieldSet;
import java.util.ArrayList;
import java.util.List;

/** Renders schedule data as canonical six-field expressions. */
public final class Display {
  private Display() {}

  /**
   * Renders schedule data as a canonical expression, seconds first.
   *
   * @param data the schedule data to render
   * @return the canonical string representation
   */
  public static String render(ScheduleData data) {
    StringBuilder sb = new StringBuilder();
    for (FieldKind kind : FieldKind.values()) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(renderField(data.field(kind)));
    }
    return sb.toString();
  }

  /**
   * Renders one field set as a field token.
   *
   * <p>A full set renders as {@code *}. Otherwise members are listed ascending, with runs of three
   * or more consecutive values written as {@code a-b}.
   *
   * @param field the field set to render
   * @return the canonical token
   */
  public static String renderField(FieldSet field) {
    if (field.isFull()) {
      return "*";
    }

    List<String> parts = new ArrayList<>();
    List<Integer> values = field.values();
    int i = 0;
    while (i < values.size()) {
      int runStart = values.get(i);
      int j = i;
      while (j + 1 < values.size() && values.get(j + 1) == values.get(j) + 1) {
        j++;
      }
      int runEnd = values.get(j);

      if (j - i >= 2) {
        parts.add(runStart + "-" + runEnd);
      } else {
        for (int k = i; k <= j; k++) {
          parts.add(String.valueOf(values.get(k)));
        }
      }
      i = j + 1;
    }
    return String.join(",", parts);
  }
}
