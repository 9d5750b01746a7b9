package org.calista.formal.lang.eval;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formal.lang.ast.Node.*;
import org.calista.formal.lang.commit.Fingerprinter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tree-walk evaluator for expression nodes.
 *
 * <p>Pure with respect to the AST: the result depends on the node and the <em>current</em>
 * contents of the {@link StateScope}, so re-evaluating after the scope changes may differ.
 * Unresolvable identifiers and unknown calls degrade to unresolved {@link Value}s instead of
 * failing. The one opt-in failure is an ambiguous bare identifier under {@link AmbiguityPolicy#FAIL}.</p>
 */
public final class ExpressionEvaluator {

    private static final Logger log = LogManager.getLogger(ExpressionEvaluator.class);

    private final Fingerprinter fingerprinter;
    private final Builtins builtins;
    private final AmbiguityPolicy ambiguity;

    public ExpressionEvaluator(Fingerprinter fingerprinter, AmbiguityPolicy ambiguity) {
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
        this.builtins = new Builtins(fingerprinter);
        this.ambiguity = ambiguity == null ? AmbiguityPolicy.FIRST_MATCH : ambiguity;
    }

    Builtins builtins() {
        return builtins;
    }

    AmbiguityPolicy ambiguityPolicy() {
        return ambiguity;
    }

    /**
     * @throws AmbiguousReferenceException for a bare identifier declared by several states
     *                                     when the policy is {@link AmbiguityPolicy#FAIL}
     */
    public Value evaluate(Expr expr, StateScope scope) {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(scope, "scope");

        if (expr instanceof NumberLit n) {
            return Value.num(n.value());
        }
        if (expr instanceof Identifier id) {
            return resolve(id, scope);
        }
        if (expr instanceof VectorExpr v) {
            return Value.vec(evaluateAll(v.elements(), scope));
        }
        if (expr instanceof CallExpr c) {
            Value out = builtins.call(c.name(), evaluateAll(c.args(), scope));
            if (!out.isResolved() && log.isDebugEnabled()) {
                log.debug("Call {} left symbolic: {}", c.name(), out);
            }
            return out;
        }
        if (expr instanceof HashExpr h) {
            return Value.text(fingerprinter.fingerprint(evaluate(h.expr(), scope).toJson()));
        }
        if (expr instanceof UpdateExpr u) {
            return new Value.PendingUpdate(u.target(), evaluate(u.value(), scope));
        }
        throw new IllegalStateException("Unhandled expression node: " + expr.getClass().getSimpleName());
    }

    private List<Value> evaluateAll(List<Expr> exprs, StateScope scope) {
        List<Value> out = new ArrayList<>(exprs.size());
        for (Expr e : exprs) out.add(evaluate(e, scope));
        return out;
    }

    // ---------------------------------------------------------------------
    // identifiers
    // ---------------------------------------------------------------------

    private Value resolve(Identifier id, StateScope scope) {
        String name = id.name();
        Map<String, ? extends Map<String, Value>> states = scope.states();

        if (id.isQualified()) {
            int dot = name.indexOf('.');
            Map<String, Value> props = states.get(name.substring(0, dot));
            Value v = props == null ? null : props.get(name.substring(dot + 1));
            return v != null ? v : Value.symbol(name);
        }

        Value first = null;
        List<String> owners = null;
        for (Map.Entry<String, ? extends Map<String, Value>> e : states.entrySet()) {
            Value v = e.getValue().get(name);
            if (v == null) continue;
            if (first == null) {
                first = v;
                owners = new ArrayList<>(2);
            }
            owners.add(e.getKey());
        }

        if (first == null) return Value.symbol(name);
        if (owners.size() > 1) {
            if (ambiguity == AmbiguityPolicy.FAIL) {
                throw new AmbiguousReferenceException(name, owners);
            }
            log.warn("Ambiguous reference '{}' (states {}), using {}", name, owners, owners.get(0));
        }
        return first;
    }
}
