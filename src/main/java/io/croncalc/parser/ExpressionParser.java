package io.croncalc.parser;

import io.croncalc.CronException;
import io.croncalc.ast.ScheduleData;
import io.croncalc.display.Display;
import io.croncalc.field.FieldKind;
import io.croncalc.field.FieldSet;
import io.croncalc.lexer.Lexer;
import io.croncalc.lexer.Token;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses 5- or 6-field schedule expressions.
 *
 * <p>Fields read left to right as {@code [second] minute hour day-of-month month day-of-week}.
 * Tokens are assigned walking back from the last one, so a 5-field expression simply has no
 * seconds token and its seconds field becomes {@code {0}}.
 */
public final class ExpressionParser {
  private static final Logger logger = LoggerFactory.getLogger(ExpressionParser.class);

  private static final int MIN_FIELDS = 5;
  private static final int MAX_FIELDS = 6;

  private static final FieldSet ZERO_SECONDS = FieldSet.of(FieldKind.SECOND, 0);

  private ExpressionParser() {}

  /**
   * Parses a schedule expression into a ScheduleData.
   *
   * @param input the expression to parse
   * @return the parsed schedule data
   * @throws CronException if the input is absent or any field is invalid
   */
  public static ScheduleData parse(String input) throws CronException {
    if (input == null) {
      throw CronException.nullInput();
    }

    List<Token> tokens = Lexer.tokenize(input);
    if (tokens.size() < MIN_FIELDS || tokens.size() > MAX_FIELDS) {
      throw CronException.tokenCount(tokens.size(), input);
    }

    FieldKind[] kinds = FieldKind.values();
    FieldSet[] fields = new FieldSet[kinds.length];
    fields[FieldKind.SECOND.ordinal()] = ZERO_SECONDS;

    int kindIndex = kinds.length - 1;
    for (int i = tokens.size() - 1; i >= 0; i--, kindIndex--) {
      Token token = tokens.get(i);
      FieldKind kind = kinds[kindIndex];
      try {
        fields[kind.ordinal()] = FieldSet.parse(token.text(), kind);
      } catch (CronException e) {
        throw e.locate(token.span(), input);
      }
    }

    ScheduleData data = ScheduleData.of(fields);
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed \"{}\" as \"{}\"", input, Display.render(data));
    }
    return data;
  }
}
