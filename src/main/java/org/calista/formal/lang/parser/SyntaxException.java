package org.calista.formal.lang.parser;

import org.calista.formal.lang.FormalException;
import org.calista.formal.lang.lexer.Token;
import org.calista.formal.lang.lexer.TokenType;

/**
 * Fatal parse failure, positioned at the offending token.
 */
public final class SyntaxException extends FormalException {
    private final TokenType tokenType;
    private final String tokenText;
    private final int line;
    private final int column;

    public SyntaxException(String message, Token offending) {
        super(message);
        this.tokenType = offending.type;
        this.tokenText = offending.text;
        this.line = offending.line;
        this.column = offending.column;
    }

    static SyntaxException expected(TokenType expected, Token got) {
        return new SyntaxException("Expected " + expected + " but got " + describe(got), got);
    }

    static SyntaxException unexpected(Token got) {
        return new SyntaxException("Unexpected token " + describe(got), got);
    }

    private static String describe(Token t) {
        return t.type + " (\"" + t.text + "\") at line " + t.line + ":" + t.column;
    }

    public TokenType tokenType() { return tokenType; }

    /** Literal text of the offending token; {@code null} at end of input. */
    public String tokenText() { return tokenText; }

    public int line() { return line; }

    public int column() { return column; }
}
