package io.croncalc.lexer;

import io.croncalc.Span;

/**
 * Represents one whitespace-delimited field token of a schedule expression.
 *
 * @param text the token text
 * @param span the location in the input
 */
public record Token(String text, Span span) {}
