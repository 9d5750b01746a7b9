package org.calista.formal.lang.universe;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.calista.formal.lang.ast.Node.Identifier;
import org.calista.formal.lang.ast.Node.Program;
import org.calista.formal.lang.commit.Fingerprinter;
import org.calista.formal.lang.eval.AmbiguityPolicy;
import org.calista.formal.lang.eval.AmbiguousReferenceException;
import org.calista.formal.lang.eval.Value;
import org.calista.formal.lang.lexer.impl.FormalLexer;
import org.calista.formal.lang.parser.Parser;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UniverseTest {

    private static final String AB = "state A { x = 1 } state B { y = 2 } transition go: A -> B";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneId.of("UTC"));

    private final FormalLexer lexer = new FormalLexer();

    private Program program(String src) {
        return Parser.parse(lexer.tokenize(src));
    }

    private Universe universe(String src) {
        return Universe.builder().clock(CLOCK).build().eval(program(src));
    }

    // ---------------------------------------------------------------------
    // eval
    // ---------------------------------------------------------------------

    @Test
    void emptyUniverse() {
        Universe u = Universe.create();
        assertThat(u.states()).isEmpty();
        assertThat(u.history()).isEmpty();
        assertThat(u.merkleRoot()).isEqualTo("0000000000000000");
    }

    @Test
    void laterPropertiesSeeEarlierOnes() {
        Universe u = universe("state A { x = 2 y = mul(x, 3) z = A.y }");
        assertThat(u.state("A")).hasValueSatisfying(a -> {
            assertThat(a.get("y")).isEqualTo(Value.num(6));
            assertThat(a.get("z")).isEqualTo(Value.num(6));
        });
    }

    @Test
    void freeExpressionsEvaluateAgainstCurrentStates() {
        Universe u = universe(AB);
        assertThat(u.evaluate(new Identifier("B.y"))).isEqualTo(Value.num(2));
        assertThat(u.evaluate(new Identifier("B.z")).isResolved()).isFalse();
    }

    @Test
    void redeclarationOverwritesInPlace() {
        Universe u = universe("state A { x = 1 } state B { y = 2 } state A { x = 5 }");
        assertThat(u.states().keySet()).containsExactly("A", "B");
        assertThat(u.states().get("A")).containsEntry("x", Value.num(5));
    }

    @Test
    void everyDeclarationKindIsStored() {
        Universe u = universe(String.join("\n",
                AB,
                "constraint positive: A.x",
                "field drift: [0.3, 0.4]",
                "micronaut step: scale(drift, 2)",
                "proof p: hash(A.x)",
                "arbitration { w = 1, v = B.y }",
                "meta rule: update(x, 5)"));

        assertThat(u.transitions()).containsKey("go");
        assertThat(u.constraints()).containsOnlyKeys("positive");
        assertThat(u.fields().get("drift")).isEqualTo(Value.vec(List.of(Value.num(0.3), Value.num(0.4))));
        assertThat(u.operators()).containsOnlyKeys("step");
        assertThat(u.proofs().get("p")).isInstanceOf(Value.Text.class);
        assertThat(u.arbitrations()).hasSize(1);
        assertThat(u.arbitrations().get(0)).containsEntry("v", Value.num(2));
        assertThat(u.metas()).containsOnlyKeys("rule");
        assertThat(u.history()).isEmpty();
    }

    @Test
    void ambiguousReferenceResolvesToFirstStateByDefault() {
        Universe u = universe("state A { x = 1 } state B { x = 2 } field f: x");
        assertThat(u.fields().get("f")).isEqualTo(Value.num(1));

        assertThatThrownBy(() -> Universe.builder().ambiguity(AmbiguityPolicy.FAIL).build()
                .eval(program("state A { x = 1 } state B { x = 2 } field f: x")))
                .isInstanceOf(AmbiguousReferenceException.class);
    }

    @Test
    void statesViewIsStableAndLive() {
        Universe u = universe("state A { x = 1 }");
        Map<String, Map<String, Value>> view = u.states();

        u.eval(program("state B { y = 2 } state A { x = 3 }"));

        assertThat(u.states()).isSameAs(view);
        assertThat(view.keySet()).containsExactly("A", "B");
        assertThat(view.get("A")).containsEntry("x", Value.num(3));
        assertThat(u.state("B").orElseThrow()).containsEntry("y", Value.num(2));
    }

    @Test
    void readViewsAreUnmodifiable() {
        Universe u = universe(AB);
        assertThatThrownBy(() -> u.states().get("A").put("x", Value.num(9)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> u.history().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    // ---------------------------------------------------------------------
    // transitions
    // ---------------------------------------------------------------------

    @Test
    void applyKnownTransition() {
        Universe u = universe(AB);
        TransitionResult r = u.applyTransition("go");

        assertThat(r.valid).isTrue();
        assertThat(r.from).isEqualTo("A");
        assertThat(r.to).isEqualTo("B");
        assertThat(r.error).isNull();
        assertThat(r.fingerprint).isNotNull().hasSize(16);
        assertThat(r.fingerprint).matches("[0-9a-f]{16}");
        assertThat(u.history()).hasSize(1);

        HistoryEntry h = u.history().get(0);
        assertThat(h.transition).isEqualTo("go");
        assertThat(h.fingerprint).isEqualTo(r.fingerprint);
        assertThat(h.timestampEpochMs).isEqualTo(CLOCK.millis());
    }

    @Test
    void fingerprintCoversEndpointContents() {
        Universe u = universe(AB);
        TransitionResult r = u.applyTransition("go");

        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode content = f.objectNode();
        content.putObject("from").put("x", 1L);
        content.putObject("to").put("y", 2L);
        content.put("transition", "go");

        assertThat(r.fingerprint).isEqualTo(new Fingerprinter().fingerprint(content));
    }

    @Test
    void unknownTransitionLeavesHistoryUntouched() {
        Universe u = universe(AB);
        TransitionResult r = u.applyTransition("missing");

        assertThat(r.valid).isFalse();
        assertThat(r.error).isEqualTo(TransitionError.UNKNOWN_TRANSITION);
        assertThat(r.message).isEqualTo("Unknown transition: missing");
        assertThat(r.fingerprint).isNull();
        assertThat(u.history()).isEmpty();
    }

    @Test
    void missingEndpointsAreReported() {
        Universe u = universe("state A { } transition in: X -> A transition out: A -> Y");

        TransitionResult in = u.applyTransition("in");
        assertThat(in.error).isEqualTo(TransitionError.MISSING_STATE);
        assertThat(in.message).isEqualTo("Source state not found: X");

        TransitionResult out = u.applyTransition("out");
        assertThat(out.error).isEqualTo(TransitionError.MISSING_STATE);
        assertThat(out.message).isEqualTo("Target state not found: Y");

        assertThat(u.historyLength()).isZero();
    }

    @Test
    void checkerViolationsRejectTransition() {
        Universe u = Universe.builder()
                .clock(CLOCK)
                .constraintChecker((t, universe) -> universe.constraints().isEmpty() ? List.of() : List.of("blocked:" + t.name))
                .build()
                .eval(program(AB + " constraint guard: A.x"));

        TransitionResult r = u.applyTransition("go");
        assertThat(r.valid).isFalse();
        assertThat(r.error).isEqualTo(TransitionError.CONSTRAINT_VIOLATION);
        assertThat(r.violations).containsExactly("blocked:go");
        assertThat(r.from).isEqualTo("A");
        assertThat(u.history()).isEmpty();
    }

    @Test
    void historySnapshotsSurviveRedeclaration() {
        Universe u = universe(AB);
        u.applyTransition("go");
        u.eval(program("state A { x = 99 }"));

        HistoryEntry h = u.history().get(0);
        assertThat(h.fromSnapshot).containsEntry("x", Value.num(1));
        assertThat(u.replayFingerprint(h)).isEqualTo(h.fingerprint);

        TransitionResult again = u.applyTransition("go");
        assertThat(again.fingerprint).isNotEqualTo(h.fingerprint);
    }

    // ---------------------------------------------------------------------
    // merkle root
    // ---------------------------------------------------------------------

    @Test
    void rootIsDeterministicUnderFixedClock() {
        Universe a = universe(AB);
        Universe b = universe(AB);
        a.applyTransition("go");
        b.applyTransition("go");

        assertThat(a.merkleRoot()).isEqualTo(b.merkleRoot()).isNotEqualTo("0000000000000000");
    }

    @Test
    void rootDependsOnHistoryOrder() {
        String src = AB + " transition back: B -> A";
        Universe a = universe(src);
        Universe b = universe(src);
        a.applyTransition("go");
        a.applyTransition("back");
        b.applyTransition("back");
        b.applyTransition("go");

        assertThat(a.merkleRoot()).isNotEqualTo(b.merkleRoot());
    }

    @Test
    void failedTransitionsDoNotMoveTheRoot() {
        Universe u = universe(AB);
        u.applyTransition("go");
        String before = u.merkleRoot();
        u.applyTransition("missing");
        assertThat(u.merkleRoot()).isEqualTo(before);
    }
}
