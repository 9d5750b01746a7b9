package org.calista.formal.lang.lexer;

import java.util.Locale;
import java.util.Map;

/**
 * Token kinds of the formal language.
 */
public enum TokenType {

    // Keywords
    STATE,
    TRANSITION,
    CONSTRAINT,
    FIELD,
    MICRONAUT,
    PROOF,
    ARBITRATION,
    META,
    HASH,
    UPDATE,

    // Delimiters
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    LBRACK,
    RBRACK,
    COLON,
    COMMA,
    ARROW,  // ->
    EQUALS,
    SEMI,

    // Literals
    IDENTIFIER,
    /** {@code state.property}; only valid where an expression or update target is expected. */
    QUALIFIED_IDENTIFIER,
    NUMBER,

    EOF;

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "state", STATE,
            "transition", TRANSITION,
            "constraint", CONSTRAINT,
            "field", FIELD,
            "micronaut", MICRONAUT,
            "proof", PROOF,
            "arbitration", ARBITRATION,
            "meta", META,
            "hash", HASH,
            "update", UPDATE
    );

    /**
     * Case-insensitive keyword lookup.
     *
     * @return keyword kind or {@code null} for a plain identifier
     */
    public static TokenType keyword(String word) {
        if (word == null) return null;
        return KEYWORDS.get(word.toLowerCase(Locale.ROOT));
    }

    /** Single-character delimiter kind, or {@code null}. */
    public static TokenType delimiter(char c) {
        switch (c) {
            case '{': return LBRACE;
            case '}': return RBRACE;
            case '(': return LPAREN;
            case ')': return RPAREN;
            case '[': return LBRACK;
            case ']': return RBRACK;
            case ':': return COLON;
            case ',': return COMMA;
            case '=': return EQUALS;
            case ';': return SEMI;
            default: return null;
        }
    }
}
