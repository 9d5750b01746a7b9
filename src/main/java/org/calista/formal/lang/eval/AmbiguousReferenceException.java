package org.calista.formal.lang.eval;

import java.util.List;

public final class AmbiguousReferenceException extends EvaluationException {
    private final String property;
    private final List<String> candidates;

    public AmbiguousReferenceException(String property, List<String> candidates) {
        super("Ambiguous reference '" + property + "': declared by states " + candidates
                + "; qualify it as <state>." + property);
        this.property = property;
        this.candidates = List.copyOf(candidates);
    }

    public String property() { return property; }

    /** States declaring the property, in declaration order. */
    public List<String> candidates() { return candidates; }
}
