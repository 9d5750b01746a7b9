package org.calista.formal.lang.eval;

/**
 * How a bare identifier is resolved when several states declare the property.
 */
public enum AmbiguityPolicy {
    /** Default: the first state in declaration order wins (logged as a warning). */
    FIRST_MATCH,
    /** Opt-in strict mode: throw {@link AmbiguousReferenceException}; use {@code state.property} instead. */
    FAIL
}
