package org.calista.formal.lang.ast;

import java.util.List;
import java.util.Objects;

/**
 * AST of the formal language. Sealed interface with record variants; records give
 * structural equality, so two parses of the same source compare equal.
 */
public sealed interface Node {

    // ---------------------------------------------------------------------
    // program / declarations
    // ---------------------------------------------------------------------

    record Program(List<Decl> declarations) implements Node {
        public Program {
            declarations = List.copyOf(declarations);
        }
    }

    sealed interface Decl extends Node {
        /** Declared name; arbitration blocks are anonymous and return {@code null}. */
        String name();
    }

    record StateDecl(String name, List<Property> properties) implements Decl {
        public StateDecl {
            Objects.requireNonNull(name, "name");
            properties = List.copyOf(properties);
        }
    }

    record TransitionDecl(String name, String from, String to) implements Decl {
        public TransitionDecl {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    record ConstraintDecl(String name, Expr expr) implements Decl {}

    record FieldDecl(String name, Expr expr) implements Decl {}

    /** {@code micronaut name : expr} */
    record OperatorDecl(String name, Expr expr) implements Decl {}

    record ProofDecl(String name, Expr expr) implements Decl {}

    record MetaDecl(String name, Expr expr) implements Decl {}

    record ArbitrationDecl(List<Property> rules) implements Decl {
        public ArbitrationDecl {
            rules = List.copyOf(rules);
        }

        @Override
        public String name() {
            return null;
        }
    }

    /** {@code name = expr}, used by state bodies and arbitration blocks. */
    record Property(String name, Expr value) implements Node {}

    // ---------------------------------------------------------------------
    // expressions
    // ---------------------------------------------------------------------

    sealed interface Expr extends Node {}

    record NumberLit(double value) implements Expr {}

    /** Bare {@code name} or qualified {@code state.property}. */
    record Identifier(String name) implements Expr {
        public boolean isQualified() {
            return name.indexOf('.') > 0;
        }
    }

    record VectorExpr(List<Expr> elements) implements Expr {
        public VectorExpr {
            elements = List.copyOf(elements);
        }
    }

    record CallExpr(String name, List<Expr> args) implements Expr {
        public CallExpr {
            args = List.copyOf(args);
        }
    }

    record HashExpr(Expr expr) implements Expr {}

    record UpdateExpr(String target, Expr value) implements Expr {}
}
