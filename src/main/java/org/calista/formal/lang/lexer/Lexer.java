package org.calista.formal.lang.lexer;

import java.util.List;

public interface Lexer {

    /**
     * Converts source text into tokens, always terminated by a single EOF token.
     */
    List<Token> tokenize(String source);

    /**
     * Same as {@link #tokenize(String)} but also reports skipped characters.
     */
    Result scan(String source);

    final class Result {
        public final List<Token> tokens;
        public final List<LexWarning> warnings;

        public Result(List<Token> tokens, List<LexWarning> warnings) {
            this.tokens = List.copyOf(tokens);
            this.warnings = List.copyOf(warnings);
        }
    }
}
