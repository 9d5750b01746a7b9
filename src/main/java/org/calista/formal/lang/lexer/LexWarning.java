package org.calista.formal.lang.lexer;

/**
 * A character the lexer skipped under {@link UnknownCharacterPolicy#SKIP}.
 */
public final class LexWarning {
    public final char character;
    public final int line;
    public final int column;

    public LexWarning(char character, int line, int column) {
        this.character = character;
        this.line = line;
        this.column = column;
    }

    public String message() {
        return "Skipped unrecognized character '" + character + "' at line " + line + ":" + column;
    }

    @Override
    public String toString() {
        return message();
    }
}
