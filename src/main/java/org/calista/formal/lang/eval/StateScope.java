package org.calista.formal.lang.eval;

import java.util.Map;

/**
 * Read view over declared states used for identifier resolution.
 * Iteration order of {@link #states()} is declaration order.
 */
@FunctionalInterface
public interface StateScope {

    Map<String, ? extends Map<String, Value>> states();
}
