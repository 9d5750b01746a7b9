package org.calista.formal.lang.universe;

import java.util.List;

/**
 * Outcome of {@link Universe#applyTransition(String)}. Failures are data, not exceptions.
 */
public final class TransitionResult {
    public final boolean valid;
    /** Hex fingerprint on success, {@code null} on failure. */
    public final String fingerprint;
    public final String from;
    public final String to;
    /** {@code null} on success. */
    public final TransitionError error;
    public final String message;
    public final List<String> violations;

    private TransitionResult(boolean valid, String fingerprint, String from, String to,
                             TransitionError error, String message, List<String> violations) {
        this.valid = valid;
        this.fingerprint = fingerprint;
        this.from = from;
        this.to = to;
        this.error = error;
        this.message = message;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    static TransitionResult ok(String fingerprint, String from, String to) {
        return new TransitionResult(true, fingerprint, from, to, null, null, List.of());
    }

    static TransitionResult unknown(String name) {
        return new TransitionResult(false, null, null, null, TransitionError.UNKNOWN_TRANSITION,
                "Unknown transition: " + name, List.of());
    }

    static TransitionResult missingState(Transition t, boolean source) {
        String msg = source
                ? "Source state not found: " + t.from
                : "Target state not found: " + t.to;
        return new TransitionResult(false, null, t.from, t.to, TransitionError.MISSING_STATE, msg, List.of());
    }

    static TransitionResult violated(Transition t, List<String> violations) {
        return new TransitionResult(false, null, t.from, t.to, TransitionError.CONSTRAINT_VIOLATION,
                "Constraint violations: " + String.join(", ", violations), violations);
    }

    @Override
    public String toString() {
        if (valid) return "TransitionResult{valid, " + from + " -> " + to + ", fingerprint=" + fingerprint + '}';
        return "TransitionResult{invalid, " + error + ": " + message + '}';
    }
}
