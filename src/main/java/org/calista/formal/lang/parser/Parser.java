package org.calista.formal.lang.parser;

import org.calista.formal.lang.ast.Node;
import org.calista.formal.lang.ast.Node.*;
import org.calista.formal.lang.lexer.Token;
import org.calista.formal.lang.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser: tokens -> {@link Program}.
 * Single pass, one token of lookahead, no backtracking, first error is fatal.
 */
public final class Parser {

    private final List<Token> tokens;
    private int pos;

    private Parser(List<Token> tokens) {
        this.tokens = terminated(tokens);
        this.pos = 0;
    }

    /**
     * @throws SyntaxException on the first token that does not fit the grammar
     */
    public static Program parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        return new Parser(tokens).program();
    }

    private static List<Token> terminated(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenType.EOF)) return tokens;
        ArrayList<Token> copy = new ArrayList<>(tokens);
        Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        copy.add(last == null ? Token.eof(1, 1) : Token.eof(last.line, last.column + 1));
        return copy;
    }

    // ---------------------------------------------------------------------
    // cursor
    // ---------------------------------------------------------------------

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (!t.is(TokenType.EOF)) pos++;
        return t;
    }

    private Token expect(TokenType type) {
        Token t = advance();
        if (!t.is(type)) throw SyntaxException.expected(type, t);
        return t;
    }

    private boolean match(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean atBlockEnd() {
        return peek().is(TokenType.RBRACE) || peek().is(TokenType.EOF);
    }

    // ---------------------------------------------------------------------
    // declarations
    // ---------------------------------------------------------------------

    private Program program() {
        List<Decl> decls = new ArrayList<>();
        while (!peek().is(TokenType.EOF)) {
            decls.add(declaration());
        }
        return new Program(decls);
    }

    private Decl declaration() {
        Token t = peek();
        switch (t.type) {
            case STATE:
                return stateDecl();
            case TRANSITION:
                return transitionDecl();
            case ARBITRATION:
                return arbitrationDecl();
            case CONSTRAINT: {
                String name = namedHeader(TokenType.CONSTRAINT);
                return new ConstraintDecl(name, expression());
            }
            case FIELD: {
                String name = namedHeader(TokenType.FIELD);
                return new FieldDecl(name, expression());
            }
            case MICRONAUT: {
                String name = namedHeader(TokenType.MICRONAUT);
                return new OperatorDecl(name, expression());
            }
            case PROOF: {
                String name = namedHeader(TokenType.PROOF);
                return new ProofDecl(name, expression());
            }
            case META: {
                String name = namedHeader(TokenType.META);
                return new MetaDecl(name, expression());
            }
            default:
                throw SyntaxException.unexpected(t);
        }
    }

    /** keyword ident ":" */
    private String namedHeader(TokenType keyword) {
        expect(keyword);
        String name = expect(TokenType.IDENTIFIER).text;
        expect(TokenType.COLON);
        return name;
    }

    private StateDecl stateDecl() {
        expect(TokenType.STATE);
        String name = expect(TokenType.IDENTIFIER).text;
        expect(TokenType.LBRACE);
        List<Property> props = new ArrayList<>();
        while (!atBlockEnd()) {
            props.add(property());
            match(TokenType.SEMI);
        }
        expect(TokenType.RBRACE);
        return new StateDecl(name, props);
    }

    private TransitionDecl transitionDecl() {
        expect(TokenType.TRANSITION);
        String name = expect(TokenType.IDENTIFIER).text;
        expect(TokenType.COLON);
        String from = expect(TokenType.IDENTIFIER).text;
        expect(TokenType.ARROW);
        String to = expect(TokenType.IDENTIFIER).text;
        return new TransitionDecl(name, from, to);
    }

    private ArbitrationDecl arbitrationDecl() {
        expect(TokenType.ARBITRATION);
        expect(TokenType.LBRACE);
        List<Property> rules = new ArrayList<>();
        while (!atBlockEnd()) {
            rules.add(property());
            match(TokenType.COMMA);
            match(TokenType.SEMI);
        }
        expect(TokenType.RBRACE);
        return new ArbitrationDecl(rules);
    }

    private Property property() {
        String name = expect(TokenType.IDENTIFIER).text;
        expect(TokenType.EQUALS);
        return new Property(name, expression());
    }

    // ---------------------------------------------------------------------
    // expressions
    // ---------------------------------------------------------------------

    private Expr expression() {
        Token t = peek();
        switch (t.type) {
            case LBRACK:
                return new VectorExpr(exprList(TokenType.LBRACK, TokenType.RBRACK));
            case HASH: {
                advance();
                expect(TokenType.LPAREN);
                Expr inner = expression();
                expect(TokenType.RPAREN);
                return new HashExpr(inner);
            }
            case UPDATE: {
                advance();
                expect(TokenType.LPAREN);
                String target = reference().text;
                expect(TokenType.COMMA);
                Expr value = expression();
                expect(TokenType.RPAREN);
                return new UpdateExpr(target, value);
            }
            case NUMBER:
                advance();
                return new NumberLit(t.number);
            case IDENTIFIER:
                advance();
                if (peek().is(TokenType.LPAREN)) {
                    return new CallExpr(t.text, exprList(TokenType.LPAREN, TokenType.RPAREN));
                }
                return new Identifier(t.text);
            case QUALIFIED_IDENTIFIER:
                advance();
                return new Identifier(t.text);
            case LPAREN: {
                advance();
                Expr inner = expression();
                expect(TokenType.RPAREN);
                return inner;
            }
            default:
                throw SyntaxException.unexpected(t);
        }
    }

    /** ident | state.property */
    private Token reference() {
        Token t = advance();
        if (!t.is(TokenType.IDENTIFIER) && !t.is(TokenType.QUALIFIED_IDENTIFIER)) {
            throw SyntaxException.expected(TokenType.IDENTIFIER, t);
        }
        return t;
    }

    /** open (Expr ("," Expr)*)? close */
    private List<Expr> exprList(TokenType open, TokenType close) {
        expect(open);
        List<Expr> out = new ArrayList<>();
        if (!peek().is(close)) {
            out.add(expression());
            while (match(TokenType.COMMA)) {
                out.add(expression());
            }
        }
        expect(close);
        return out;
    }
}
