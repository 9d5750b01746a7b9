package org.calista.formal.lang.universe;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formal.lang.ast.Node.*;
import org.calista.formal.lang.commit.Fingerprinter;
import org.calista.formal.lang.commit.MerkleCompressor;
import org.calista.formal.lang.eval.AmbiguityPolicy;
import org.calista.formal.lang.eval.ExpressionEvaluator;
import org.calista.formal.lang.eval.StateScope;
import org.calista.formal.lang.eval.Value;
import org.calista.formal.lang.export.Brain;
import org.calista.formal.lang.export.BrainExporter;
import org.calista.formal.lang.universe.impl.ExistenceConstraintChecker;

import java.time.Clock;
import java.util.*;

/**
 * Universe: mutable runtime of one formal-language program.
 *
 * <p>Lifecycle: created empty, populated by {@link #eval(Program)}, then any number of
 * {@link #applyTransition(String)} calls (further {@code eval} calls may be interleaved).
 * No global instance: the caller constructs and owns it. Not thread-safe; use one Universe
 * per worker.</p>
 *
 * <p>Names are unique per kind; redeclaring overwrites (last write wins) and keeps the
 * original declaration position.</p>
 */
public final class Universe implements StateScope {

    private static final Logger log = LogManager.getLogger(Universe.class);

    // S, T, C, F, M, P + arbitration rule sets, meta rules, H
    private final Map<String, Map<String, Value>> states = new LinkedHashMap<>();
    // read-only property views, kept in step with states
    private final Map<String, Map<String, Value>> stateViews = new LinkedHashMap<>();
    private final Map<String, Map<String, Value>> statesView = Collections.unmodifiableMap(stateViews);
    private final Map<String, Transition> transitions = new LinkedHashMap<>();
    private final Map<String, Expr> constraints = new LinkedHashMap<>();
    private final Map<String, Value> fields = new LinkedHashMap<>();
    private final Map<String, Expr> operators = new LinkedHashMap<>();
    private final Map<String, Value> proofs = new LinkedHashMap<>();
    private final List<Map<String, Value>> arbitrations = new ArrayList<>();
    private final Map<String, Expr> metas = new LinkedHashMap<>();
    private final List<HistoryEntry> history = new ArrayList<>();

    private final Clock clock;
    private final Fingerprinter fingerprinter;
    private final ExpressionEvaluator evaluator;
    private final ConstraintChecker constraintChecker;

    private Universe(Builder b) {
        this.clock = b.clock;
        this.fingerprinter = b.fingerprinter;
        this.evaluator = new ExpressionEvaluator(b.fingerprinter, b.ambiguity);
        this.constraintChecker = b.constraintChecker;
    }

    /** Empty universe with default settings. */
    public static Universe create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private Fingerprinter fingerprinter = new Fingerprinter();
        private AmbiguityPolicy ambiguity = AmbiguityPolicy.FIRST_MATCH;
        private ConstraintChecker constraintChecker = ExistenceConstraintChecker.INSTANCE;

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder fingerprinter(Fingerprinter fingerprinter) {
            this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
            return this;
        }

        public Builder ambiguity(AmbiguityPolicy ambiguity) {
            this.ambiguity = Objects.requireNonNull(ambiguity, "ambiguity");
            return this;
        }

        public Builder constraintChecker(ConstraintChecker checker) {
            this.constraintChecker = Objects.requireNonNull(checker, "constraintChecker");
            return this;
        }

        public Universe build() {
            return new Universe(this);
        }
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    /**
     * Folds every declaration into this universe, in document order.
     *
     * @return this
     */
    public Universe eval(Program program) {
        Objects.requireNonNull(program, "program");
        for (Decl d : program.declarations()) {
            declare(d);
        }
        if (log.isDebugEnabled()) {
            log.debug("eval: {} declaration(s) -> states={} transitions={} constraints={} fields={}",
                    program.declarations().size(), states.size(), transitions.size(), constraints.size(), fields.size());
        }
        return this;
    }

    public void declare(Decl decl) {
        Objects.requireNonNull(decl, "decl");

        if (decl instanceof StateDecl s) {
            // the entry exists before its properties are evaluated, so later ones can see earlier ones
            Map<String, Value> props = new LinkedHashMap<>();
            states.put(s.name(), props);
            stateViews.put(s.name(), Collections.unmodifiableMap(props));
            for (Property p : s.properties()) {
                props.put(p.name(), evaluator.evaluate(p.value(), this));
            }
        } else if (decl instanceof TransitionDecl t) {
            transitions.put(t.name(), new Transition(t.name(), t.from(), t.to()));
        } else if (decl instanceof ConstraintDecl c) {
            constraints.put(c.name(), c.expr());
        } else if (decl instanceof FieldDecl f) {
            fields.put(f.name(), evaluator.evaluate(f.expr(), this));
        } else if (decl instanceof OperatorDecl o) {
            operators.put(o.name(), o.expr());
        } else if (decl instanceof ProofDecl p) {
            proofs.put(p.name(), evaluator.evaluate(p.expr(), this));
        } else if (decl instanceof ArbitrationDecl a) {
            Map<String, Value> rules = new LinkedHashMap<>();
            for (Property r : a.rules()) {
                rules.put(r.name(), evaluator.evaluate(r.value(), this));
            }
            arbitrations.add(Collections.unmodifiableMap(rules));
        } else if (decl instanceof MetaDecl m) {
            metas.put(m.name(), m.expr());
        } else {
            throw new IllegalStateException("Unhandled declaration: " + decl.getClass().getSimpleName());
        }
    }

    /** Evaluates a free-standing expression against the current states. */
    public Value evaluate(Expr expr) {
        return evaluator.evaluate(expr, this);
    }

    // ---------------------------------------------------------------------
    // State evolution
    // ---------------------------------------------------------------------

    /**
     * Applies a transition by name. Never throws for domain failures; a failed result leaves
     * the universe unchanged.
     *
     * <p>Fingerprint = H({from: snapshot(S_t), to: snapshot(S_t+1), transition: name}).</p>
     */
    public TransitionResult applyTransition(String name) {
        Transition t = name == null ? null : transitions.get(name);
        if (t == null) {
            log.debug("applyTransition: unknown transition {}", name);
            return TransitionResult.unknown(name);
        }

        Map<String, Value> fromState = states.get(t.from);
        Map<String, Value> toState = states.get(t.to);
        if (fromState == null) return TransitionResult.missingState(t, true);
        if (toState == null) return TransitionResult.missingState(t, false);

        List<String> violations = constraintChecker.check(t, this);
        if (!violations.isEmpty()) {
            log.info("Transition {} rejected: {}", t.name, violations);
            return TransitionResult.violated(t, violations);
        }

        Map<String, Value> fromSnap = HistoryEntry.snapshot(fromState);
        Map<String, Value> toSnap = HistoryEntry.snapshot(toState);
        String fingerprint = transitionFingerprint(t.name, fromSnap, toSnap);

        HistoryEntry entry = new HistoryEntry(t.name, t.from, t.to, fingerprint, clock.millis(), fromSnap, toSnap);
        history.add(entry);

        if (log.isDebugEnabled()) {
            log.debug("Transition applied: {} ({} -> {}) fingerprint={} historyLength={}",
                    t.name, t.from, t.to, fingerprint, history.size());
        }
        return TransitionResult.ok(fingerprint, t.from, t.to);
    }

    /**
     * Recomputes the fingerprint a history entry should carry, from its own snapshots.
     * Equal to {@link HistoryEntry#fingerprint} for every entry this universe produced.
     */
    public String replayFingerprint(HistoryEntry entry) {
        Objects.requireNonNull(entry, "entry");
        return transitionFingerprint(entry.transition, entry.fromSnapshot, entry.toSnapshot);
    }

    private String transitionFingerprint(String name, Map<String, Value> from, Map<String, Value> to) {
        ObjectNode content = JsonNodeFactory.instance.objectNode();
        content.set("from", propsJson(from));
        content.set("to", propsJson(to));
        content.put("transition", name);
        return fingerprinter.fingerprint(content);
    }

    private static ObjectNode propsJson(Map<String, Value> props) {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, Value> e : props.entrySet()) {
            o.set(e.getKey(), e.getValue().toJson());
        }
        return o;
    }

    // ---------------------------------------------------------------------
    // History / commitment
    // ---------------------------------------------------------------------

    /** Immutable copy of the history, oldest first. */
    public List<HistoryEntry> history() {
        return List.copyOf(history);
    }

    public int historyLength() {
        return history.size();
    }

    /**
     * Merkle root over the history; all-zero sentinel when the history is empty.
     */
    public String merkleRoot() {
        List<String> leaves = new ArrayList<>(history.size());
        for (HistoryEntry h : history) {
            leaves.add(Fingerprinter.canonical(h.toJson()));
        }
        return new MerkleCompressor(fingerprinter).root(leaves);
    }

    // ---------------------------------------------------------------------
    // Export
    // ---------------------------------------------------------------------

    /** Fresh, read-only graph projection of this universe. */
    public Brain toBrain(String domain) {
        return new BrainExporter(fingerprinter, clock).toBrain(this, domain);
    }

    // ---------------------------------------------------------------------
    // Read views
    // ---------------------------------------------------------------------

    /** States in declaration order; property maps are read-only views. */
    @Override
    public Map<String, Map<String, Value>> states() {
        return statesView;
    }

    public Optional<Map<String, Value>> state(String name) {
        return Optional.ofNullable(stateViews.get(name));
    }

    public Map<String, Transition> transitions() {
        return Collections.unmodifiableMap(transitions);
    }

    public Map<String, Expr> constraints() {
        return Collections.unmodifiableMap(constraints);
    }

    public Map<String, Value> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /** {@code micronaut} declarations, kept as unevaluated expressions. */
    public Map<String, Expr> operators() {
        return Collections.unmodifiableMap(operators);
    }

    public Map<String, Value> proofs() {
        return Collections.unmodifiableMap(proofs);
    }

    public List<Map<String, Value>> arbitrations() {
        return Collections.unmodifiableList(arbitrations);
    }

    public Map<String, Expr> metas() {
        return Collections.unmodifiableMap(metas);
    }

    public Fingerprinter fingerprinter() {
        return fingerprinter;
    }

    public Clock clock() {
        return clock;
    }
}
