package org.calista.formal.lang.lexer;

import java.util.Objects;

/**
 * Immutable lexical token. Line and column are 1-based.
 *
 * <p>{@code text} is the literal source text (lower-cased for keywords); {@code number}
 * is only meaningful for {@link TokenType#NUMBER}.</p>
 */
public final class Token {
    public final TokenType type;
    public final String text;
    public final double number;
    public final int line;
    public final int column;

    private Token(TokenType type, String text, double number, int line, int column) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = text;
        this.number = number;
        this.line = line;
        this.column = column;
    }

    public static Token of(TokenType type, String text, int line, int column) {
        return new Token(type, text, Double.NaN, line, column);
    }

    public static Token number(String text, double value, int line, int column) {
        return new Token(TokenType.NUMBER, text, value, line, column);
    }

    public static Token eof(int line, int column) {
        return new Token(TokenType.EOF, null, Double.NaN, line, column);
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Token t)) return false;
        return type == t.type
                && line == t.line
                && column == t.column
                && Objects.equals(text, t.text)
                && Double.doubleToLongBits(number) == Double.doubleToLongBits(t.number);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, line, column);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
