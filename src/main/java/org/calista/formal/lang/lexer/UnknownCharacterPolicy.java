package org.calista.formal.lang.lexer;

/**
 * What the lexer does with a character that starts no token.
 */
public enum UnknownCharacterPolicy {
    /** Drop the character and record a {@link LexWarning}. */
    SKIP,
    /** Throw {@link LexicalException}. */
    FAIL
}
