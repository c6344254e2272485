package io.croncalc.lexer;

import io.croncalc.Span;
import java.util.ArrayList;
import java.util.List;

/** Splits a schedule expression into field tokens on runs of whitespace. */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the input string into a list of field tokens.
   *
   * @param input the input string to tokenize
   * @return the tokens in input order; empty for blank input
   */
  public static List<Token> tokenize(String input) {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        break;
      }

      int start = pos;
      while (pos < input.length() && !Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
      tokens.add(new Token(input.substring(start, pos), new Span(start, pos)));
    }
    return tokens;
  }

  private void skipWhitespace() {
    while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }
}
