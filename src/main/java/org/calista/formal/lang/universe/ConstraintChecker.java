package org.calista.formal.lang.universe;

import java.util.List;

/**
 * Decides whether a transition may enter its target state.
 *
 * <p>Declared constraint expressions are available through {@link Universe#constraints()};
 * evaluating them is left to implementations.</p>
 */
@FunctionalInterface
public interface ConstraintChecker {

    /**
     * @return violation descriptions; empty when the transition may proceed
     */
    List<String> check(Transition transition, Universe universe);
}
