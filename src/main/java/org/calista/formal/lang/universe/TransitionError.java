package org.calista.formal.lang.universe;

public enum TransitionError {
    UNKNOWN_TRANSITION,
    /** Source or target state is not declared. */
    MISSING_STATE,
    CONSTRAINT_VIOLATION
}
