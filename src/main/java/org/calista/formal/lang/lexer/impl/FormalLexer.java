package org.calista.formal.lang.lexer.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formal.lang.lexer.LexWarning;
import org.calista.formal.lang.lexer.Lexer;
import org.calista.formal.lang.lexer.LexicalException;
import org.calista.formal.lang.lexer.Token;
import org.calista.formal.lang.lexer.TokenType;
import org.calista.formal.lang.lexer.UnknownCharacterPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Lexer for the formal language:
 * - single pass, no regex
 * - {@code //} line comments and whitespace are dropped
 * - {@code ->}, ten single-char delimiters, signed decimals, identifiers/keywords
 * - {@code state.property} is scanned as one QUALIFIED_IDENTIFIER token
 * - unknown characters: skipped with a warning, or fatal (see {@link UnknownCharacterPolicy})
 */
public final class FormalLexer implements Lexer {

    private static final Logger log = LogManager.getLogger(FormalLexer.class);

    private final UnknownCharacterPolicy unknownPolicy;
    private final boolean qualifiedIdentifiers;

    public FormalLexer() {
        this(new Config());
    }

    public FormalLexer(Config cfg) {
        Objects.requireNonNull(cfg, "cfg");
        this.unknownPolicy = cfg.unknownCharacters == null ? UnknownCharacterPolicy.SKIP : cfg.unknownCharacters;
        this.qualifiedIdentifiers = cfg.qualifiedIdentifiers;
    }

    @Override
    public List<Token> tokenize(String source) {
        return scan(source).tokens;
    }

    @Override
    public Result scan(String source) {
        String s = source == null ? "" : source;

        ArrayList<Token> out = new ArrayList<>(Math.max(16, s.length() / 3));
        ArrayList<LexWarning> warnings = new ArrayList<>(0);

        final int n = s.length();
        int i = 0;
        int line = 1;
        int col = 1;

        while (i < n) {
            char c = s.charAt(i);

            if (c == '\n') {
                line++;
                col = 1;
                i++;
                continue;
            }
            if (Character.isWhitespace(c)) {
                col++;
                i++;
                continue;
            }

            // comment to end of line; the newline itself is handled above
            if (c == '/' && i + 1 < n && s.charAt(i + 1) == '/') {
                while (i < n && s.charAt(i) != '\n') {
                    i++;
                    col++;
                }
                continue;
            }

            if (c == '-' && i + 1 < n && s.charAt(i + 1) == '>') {
                out.add(Token.of(TokenType.ARROW, "->", line, col));
                i += 2;
                col += 2;
                continue;
            }

            TokenType delim = TokenType.delimiter(c);
            if (delim != null) {
                out.add(Token.of(delim, String.valueOf(c), line, col));
                i++;
                col++;
                continue;
            }

            if (isDigit(c) || (c == '-' && i + 1 < n && isDigit(s.charAt(i + 1)))) {
                int j = consumeNumber(s, i);
                String text = s.substring(i, j);
                out.add(Token.number(text, Double.parseDouble(text), line, col));
                col += j - i;
                i = j;
                continue;
            }

            if (isIdentStart(c)) {
                int j = consumeIdent(s, i);
                boolean qualified = false;
                if (qualifiedIdentifiers && j + 1 < n && s.charAt(j) == '.' && isIdentStart(s.charAt(j + 1))) {
                    j = consumeIdent(s, j + 1);
                    qualified = true;
                }

                String text = s.substring(i, j);
                TokenType kw = qualified ? null : TokenType.keyword(text);
                if (kw != null) {
                    out.add(Token.of(kw, text.toLowerCase(Locale.ROOT), line, col));
                } else {
                    out.add(Token.of(qualified ? TokenType.QUALIFIED_IDENTIFIER : TokenType.IDENTIFIER, text, line, col));
                }
                col += j - i;
                i = j;
                continue;
            }

            if (unknownPolicy == UnknownCharacterPolicy.FAIL) {
                throw new LexicalException(c, line, col);
            }
            LexWarning w = new LexWarning(c, line, col);
            warnings.add(w);
            if (log.isDebugEnabled()) log.debug(w.message());
            i++;
            col++;
        }

        out.add(Token.eof(line, col));

        if (!warnings.isEmpty()) {
            log.warn("Lexer skipped {} unrecognized character(s); first at line {}:{}",
                    warnings.size(), warnings.get(0).line, warnings.get(0).column);
        }
        return new Result(out, warnings);
    }

    // ---------------------------------------------------------------------
    // character classes
    // ---------------------------------------------------------------------

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }

    /** [-]digits[.digits] */
    private static int consumeNumber(String s, int start) {
        final int n = s.length();
        int j = start;
        if (s.charAt(j) == '-') j++;
        while (j < n && isDigit(s.charAt(j))) j++;
        if (j + 1 < n && s.charAt(j) == '.' && isDigit(s.charAt(j + 1))) {
            j++;
            while (j < n && isDigit(s.charAt(j))) j++;
        }
        return j;
    }

    private static int consumeIdent(String s, int start) {
        final int n = s.length();
        int j = start + 1;
        while (j < n && isIdentPart(s.charAt(j))) j++;
        return j;
    }

    // ---------------------------------------------------------------------
    // config
    // ---------------------------------------------------------------------

    public static final class Config {
        public UnknownCharacterPolicy unknownCharacters = UnknownCharacterPolicy.SKIP;
        public boolean qualifiedIdentifiers = true;
    }
}
