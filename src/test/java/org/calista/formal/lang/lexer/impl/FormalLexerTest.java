package org.calista.formal.lang.lexer.impl;

import org.calista.formal.lang.lexer.LexWarning;
import org.calista.formal.lang.lexer.Lexer;
import org.calista.formal.lang.lexer.LexicalException;
import org.calista.formal.lang.lexer.Token;
import org.calista.formal.lang.lexer.TokenType;
import org.calista.formal.lang.lexer.UnknownCharacterPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormalLexerTest {

    private final FormalLexer lexer = new FormalLexer();

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(t -> t.type).collect(Collectors.toList());
    }

    @Test
    void emptySourceYieldsSingleEof() {
        List<Token> tokens = lexer.tokenize("");
        assertThat(types(tokens)).containsExactly(TokenType.EOF);
        assertThat(tokens.get(0).line).isEqualTo(1);
        assertThat(tokens.get(0).column).isEqualTo(1);
    }

    @Test
    void stateDeclarationTokens() {
        List<Token> tokens = lexer.tokenize("state A { x = 1 }");
        assertThat(types(tokens)).containsExactly(
                TokenType.STATE, TokenType.IDENTIFIER, TokenType.LBRACE,
                TokenType.IDENTIFIER, TokenType.EQUALS, TokenType.NUMBER,
                TokenType.RBRACE, TokenType.EOF);
        assertThat(tokens.get(5).number).isEqualTo(1.0);
    }

    @Test
    void keywordsAreCaseInsensitive() {
        List<Token> tokens = lexer.tokenize("STATE Transition MicroNaut");
        assertThat(types(tokens)).containsExactly(TokenType.STATE, TokenType.TRANSITION, TokenType.MICRONAUT, TokenType.EOF);
        assertThat(tokens.get(1).text).isEqualTo("transition");
    }

    @Test
    void arrowIsOneTokenAndNegativeNumbersAreLiterals() {
        List<Token> tokens = lexer.tokenize("transition go: A -> B\nstate C { v = -2.5 }");
        assertThat(types(tokens)).contains(TokenType.ARROW);
        Token neg = tokens.stream().filter(t -> t.is(TokenType.NUMBER)).findFirst().orElseThrow();
        assertThat(neg.text).isEqualTo("-2.5");
        assertThat(neg.number).isEqualTo(-2.5);
    }

    @Test
    void positionsTrackLinesAndColumns() {
        List<Token> tokens = lexer.tokenize("state A {\n  x = 1\n}");
        Token x = tokens.get(3);
        assertThat(x.text).isEqualTo("x");
        assertThat(x.line).isEqualTo(2);
        assertThat(x.column).isEqualTo(3);
        Token close = tokens.get(6);
        assertThat(close.type).isEqualTo(TokenType.RBRACE);
        assertThat(close.line).isEqualTo(3);
        assertThat(close.column).isEqualTo(1);
    }

    @Test
    void commentsRunToEndOfLine() {
        List<Token> tokens = lexer.tokenize("// header\nstate A {} // trailing { junk\n");
        assertThat(types(tokens)).containsExactly(
                TokenType.STATE, TokenType.IDENTIFIER, TokenType.LBRACE, TokenType.RBRACE, TokenType.EOF);
        assertThat(tokens.get(0).line).isEqualTo(2);
    }

    @Test
    void qualifiedIdentifierIsSingleToken() {
        List<Token> tokens = lexer.tokenize("A.x");
        assertThat(types(tokens)).containsExactly(TokenType.QUALIFIED_IDENTIFIER, TokenType.EOF);
        assertThat(tokens.get(0).text).isEqualTo("A.x");
    }

    @Test
    void qualifiedKeywordLikeNameStaysIdentifier() {
        List<Token> tokens = lexer.tokenize("state.field");
        assertThat(types(tokens)).containsExactly(TokenType.QUALIFIED_IDENTIFIER, TokenType.EOF);
    }

    @Test
    void qualificationCanBeDisabled() {
        FormalLexer.Config cfg = new FormalLexer.Config();
        cfg.qualifiedIdentifiers = false;
        Lexer.Result r = new FormalLexer(cfg).scan("A.x");
        assertThat(types(r.tokens)).containsExactly(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(r.warnings).extracting(w -> w.character).containsExactly('.');
    }

    @Test
    void unknownCharactersAreSkippedWithWarnings() {
        Lexer.Result r = lexer.scan("state A { x = 1 @ }");
        assertThat(types(r.tokens)).endsWith(TokenType.RBRACE, TokenType.EOF);
        assertThat(r.warnings).hasSize(1);
        LexWarning w = r.warnings.get(0);
        assertThat(w.character).isEqualTo('@');
        assertThat(w.line).isEqualTo(1);
        assertThat(w.column).isEqualTo(17);
    }

    @Test
    void failPolicyRejectsUnknownCharacters() {
        FormalLexer.Config cfg = new FormalLexer.Config();
        cfg.unknownCharacters = UnknownCharacterPolicy.FAIL;
        FormalLexer strict = new FormalLexer(cfg);

        assertThatThrownBy(() -> strict.tokenize("state A {\n x = $ }"))
                .isInstanceOf(LexicalException.class)
                .hasMessageContaining("'$'")
                .hasMessageContaining("line 2:6");
    }

    @Test
    void tokenizeIsDeterministic() {
        String src = "state A { x = 1 } field f: [1, 2]";
        assertThat(lexer.tokenize(src)).isEqualTo(lexer.tokenize(src));
    }
}
