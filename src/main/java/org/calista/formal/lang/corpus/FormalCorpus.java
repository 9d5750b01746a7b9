package org.calista.formal.lang.corpus;

import java.util.Locale;
import java.util.Optional;

/**
 * Axiomatic catalogue the formal language is built on: the sets a Universe is made of,
 * the algebraic structures it relies on, and the theory each runtime domain maps to.
 * Read-only reference data.
 */
public final class FormalCorpus {

    private FormalCorpus() {
    }

    /** Sets a Universe is made of. */
    public enum MathSet {
        S("State space"),
        T("Transition operators"),
        C("Constraints (invariants)"),
        P("Proof objects (commitments)"),
        F("Fields (vector influences)"),
        M("Micronaut operators"),
        H("Histories (transition chains)");

        public final String description;

        MathSet(String description) {
            this.description = description;
        }

        public String symbol() {
            return name();
        }
    }

    public enum Structure {
        MONOID("Monoid", "sequential composition of transitions"),
        GRAPH("Graph", "state space topology"),
        VECTOR_SPACE("Vector space", "embedding geometry"),
        PARTIAL_ORDER("Partial order", "causality ordering"),
        CATEGORY("Category", "universes + morphisms (bridges)"),
        MERKLE_TREE("Merkle tree", "commitment hierarchy");

        public final String displayName;
        public final String role;

        Structure(String displayName, String role) {
            this.displayName = displayName;
            this.role = role;
        }
    }

    /** Runtime domain and the theory backing it. */
    public enum DomainBinding {
        ARBITRATION("vector_decomposition"),
        MEMORY("attractor_dynamics"),
        LEARNING("gradient_flow"),
        PROOF("hash_commitments"),
        FEDERATION("category_morphisms"),
        STABILITY("lyapunov_theory");

        public final String theory;

        DomainBinding(String theory) {
            this.theory = theory;
        }

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        /** Case-insensitive lookup by key ({@code "arbitration"}, ...). */
        public static Optional<DomainBinding> of(String key) {
            if (key == null) return Optional.empty();
            String k = key.trim().toUpperCase(Locale.ROOT);
            for (DomainBinding d : values()) {
                if (d.name().equals(k)) return Optional.of(d);
            }
            return Optional.empty();
        }
    }

    /** Multi-line listing for the console. */
    public static String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Sets:\n");
        for (MathSet s : MathSet.values()) {
            sb.append("  ").append(s.symbol()).append("  ").append(s.description).append('\n');
        }
        sb.append("Structures:\n");
        for (Structure s : Structure.values()) {
            sb.append("  ").append(s.displayName).append(": ").append(s.role).append('\n');
        }
        sb.append("Domains:\n");
        for (DomainBinding d : DomainBinding.values()) {
            sb.append("  ").append(d.key()).append(" -> ").append(d.theory).append('\n');
        }
        return sb.toString();
    }
}
