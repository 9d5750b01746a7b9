package org.calista.formal.lang.universe;

import java.util.Objects;

/** Named directed edge between two state names; endpoints are checked at apply time. */
public final class Transition {
    public final String name;
    public final String from;
    public final String to;

    public Transition(String name, String from, String to) {
        this.name = Objects.requireNonNull(name, "name");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Transition t && t.name.equals(name) && t.from.equals(from) && t.to.equals(to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, from, to);
    }

    @Override
    public String toString() {
        return name + ": " + from + " -> " + to;
    }
}
