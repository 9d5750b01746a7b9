package org.calista.formal.lang.universe.impl;

import org.calista.formal.lang.universe.ConstraintChecker;
import org.calista.formal.lang.universe.Transition;
import org.calista.formal.lang.universe.Universe;

import java.util.List;

/**
 * Default checker: every declared constraint passes as long as the target state exists.
 */
public final class ExistenceConstraintChecker implements ConstraintChecker {

    public static final ExistenceConstraintChecker INSTANCE = new ExistenceConstraintChecker();

    @Override
    public List<String> check(Transition transition, Universe universe) {
        if (universe.state(transition.to).isPresent()) return List.of();
        return List.of("state_not_found:" + transition.to);
    }
}
