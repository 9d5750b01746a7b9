package org.calista.formal.lang.lexer;

import org.calista.formal.lang.FormalException;

public final class LexicalException extends FormalException {
    private final char character;
    private final int line;
    private final int column;

    public LexicalException(char character, int line, int column) {
        super("Unrecognized character '" + character + "' at line " + line + ":" + column);
        this.character = character;
        this.line = line;
        this.column = column;
    }

    public char character() { return character; }

    public int line() { return line; }

    public int column() { return column; }
}
