package org.calista.formal.lang.parser;

import org.calista.formal.lang.ast.Node.*;
import org.calista.formal.lang.lexer.TokenType;
import org.calista.formal.lang.lexer.impl.FormalLexer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ParserTest {

    private final FormalLexer lexer = new FormalLexer();

    private Program parse(String src) {
        return Parser.parse(lexer.tokenize(src));
    }

    @Test
    void emptyProgram() {
        assertThat(parse("").declarations()).isEmpty();
        assertThat(parse("// only a comment").declarations()).isEmpty();
    }

    @Test
    void stateWithOptionalSemicolons() {
        Program p = parse("state A { x = 1; y = [1, 2] z = hash(x) }");
        assertThat(p.declarations()).hasSize(1);
        StateDecl a = (StateDecl) p.declarations().get(0);
        assertThat(a.name()).isEqualTo("A");
        assertThat(a.properties()).extracting(Property::name).containsExactly("x", "y", "z");
        assertThat(a.properties().get(0).value()).isEqualTo(new NumberLit(1));
        assertThat(a.properties().get(1).value())
                .isEqualTo(new VectorExpr(List.of(new NumberLit(1), new NumberLit(2))));
        assertThat(a.properties().get(2).value()).isEqualTo(new HashExpr(new Identifier("x")));
    }

    @Test
    void everyDeclarationKind() {
        Program p = parse(String.join("\n",
                "state A { }",
                "transition go: A -> B",
                "constraint positive: A.x",
                "field drift: [0.1, 0.2]",
                "micronaut step: scale(drift, 2)",
                "proof p1: hash(A)",
                "arbitration { w = 1, v = 2; u = 3 }",
                "meta rule: update(x, 5)"));

        assertThat(p.declarations()).hasSize(8);
        assertThat(p.declarations().get(1)).isEqualTo(new TransitionDecl("go", "A", "B"));
        assertThat(p.declarations().get(2)).isEqualTo(new ConstraintDecl("positive", new Identifier("A.x")));
        assertThat(p.declarations().get(3)).isInstanceOf(FieldDecl.class);
        assertThat(p.declarations().get(4)).isEqualTo(new OperatorDecl("step",
                new CallExpr("scale", List.of(new Identifier("drift"), new NumberLit(2)))));
        assertThat(p.declarations().get(5)).isInstanceOf(ProofDecl.class);

        ArbitrationDecl arb = (ArbitrationDecl) p.declarations().get(6);
        assertThat(arb.name()).isNull();
        assertThat(arb.rules()).extracting(Property::name).containsExactly("w", "v", "u");

        assertThat(p.declarations().get(7))
                .isEqualTo(new MetaDecl("rule", new UpdateExpr("x", new NumberLit(5))));
    }

    @Test
    void parenthesizedExpressionUnwraps() {
        FieldDecl f = (FieldDecl) parse("field f: ((norm([3, 4])))").declarations().get(0);
        assertThat(f.expr()).isEqualTo(new CallExpr("norm",
                List.of(new VectorExpr(List.of(new NumberLit(3), new NumberLit(4))))));
    }

    @Test
    void emptyCallAndVector() {
        FieldDecl f = (FieldDecl) parse("field f: g()").declarations().get(0);
        assertThat(f.expr()).isEqualTo(new CallExpr("g", List.of()));
        FieldDecl v = (FieldDecl) parse("field v: []").declarations().get(0);
        assertThat(v.expr()).isEqualTo(new VectorExpr(List.of()));
    }

    @Test
    void missingValueReportsLineOfClosingBrace() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("state A {\n  x =\n}"));

        assertThat(e.line()).isEqualTo(3);
        assertThat(e.tokenType()).isEqualTo(TokenType.RBRACE);
        assertThat(e.getMessage()).contains("line 3");
    }

    @Test
    void missingValueOnOneLine() {
        assertThatThrownBy(() -> parse("state A { x = }"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageContaining("RBRACE")
                .hasMessageContaining("line 1:15");
    }

    @Test
    void transitionWithoutArrowNamesExpectedToken() {
        assertThatThrownBy(() -> parse("transition go: A B"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Expected ARROW but got IDENTIFIER");
    }

    @Test
    void qualifiedNamesAreRejectedOutsideExpressions() {
        assertThatThrownBy(() -> parse("transition t: A.b -> C"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Expected IDENTIFIER but got QUALIFIED_IDENTIFIER");
        assertThatThrownBy(() -> parse("transition t: A -> C.d")).isInstanceOf(SyntaxException.class);
        assertThatThrownBy(() -> parse("state A.b { }")).isInstanceOf(SyntaxException.class);
        assertThatThrownBy(() -> parse("state A { A.x = 1 }")).isInstanceOf(SyntaxException.class);
        assertThatThrownBy(() -> parse("field A.f: 1")).isInstanceOf(SyntaxException.class);
        assertThatThrownBy(() -> parse("arbitration { A.w = 1 }")).isInstanceOf(SyntaxException.class);
    }

    @Test
    void qualifiedNamesAreAcceptedInExpressionsAndUpdateTargets() {
        Program p = parse("state A { x = 1 } field f: A.x meta m: update(A.x, 2)");
        assertThat(p.declarations().get(1)).isEqualTo(new FieldDecl("f", new Identifier("A.x")));
        assertThat(p.declarations().get(2))
                .isEqualTo(new MetaDecl("m", new UpdateExpr("A.x", new NumberLit(2))));
    }

    @Test
    void unterminatedBlockFailsAtEof() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("state A { x = 1"));
        assertThat(e.tokenType()).isEqualTo(TokenType.EOF);
        assertThat(e.tokenText()).isNull();
    }

    @Test
    void strayTopLevelTokenIsRejected() {
        assertThatThrownBy(() -> parse("x = 1"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Unexpected token IDENTIFIER");
    }

    @Test
    void tokenListWithoutEofIsTerminated() {
        Program p = Parser.parse(lexer.tokenize("state A { }").subList(0, 4));
        assertThat(p.declarations()).containsExactly(new StateDecl("A", List.of()));
    }

    @Test
    void parsingIsDeterministic() {
        String src = "state A { x = 1 } transition t: A -> A field f: sum(1, 2)";
        assertThat(parse(src)).isEqualTo(parse(src));
    }
}
