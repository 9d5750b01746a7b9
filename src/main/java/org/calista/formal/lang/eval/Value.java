package org.calista.formal.lang.eval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of evaluating an expression.
 *
 * <p>Resolved variants: {@link Num}, {@link Vec}, {@link Text}, {@link PendingUpdate}.
 * Unresolved variants ({@link #isResolved()} is false): {@link Symbol} for an identifier that
 * matched no property, {@link Call} for an unknown function or ill-shaped arguments.</p>
 *
 * <p>All variants are immutable.</p>
 */
public sealed interface Value {

    boolean isResolved();

    /** Canonical JSON form, used for fingerprints and export. */
    JsonNode toJson();

    static Num num(double v) { return new Num(v); }

    static Vec vec(List<? extends Value> items) { return new Vec(items); }

    static Text text(String s) { return new Text(s); }

    static Symbol symbol(String name) { return new Symbol(name); }

    // ---------------------------------------------------------------------

    final class Num implements Value {
        public final double value;

        Num(double value) {
            this.value = value;
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        /** Integral values render without a fraction so 1 and 1.0 hash identically. */
        @Override
        public JsonNode toJson() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 9.0e15) {
                return JsonNodeFactory.instance.numberNode((long) value);
            }
            return JsonNodeFactory.instance.numberNode(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Num n && Double.compare(n.value, value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return toJson().toString();
        }
    }

    final class Vec implements Value {
        public final List<Value> items;

        Vec(List<? extends Value> items) {
            this.items = List.copyOf(items);
        }

        /** True when every element is a number (an empty vector qualifies). */
        public boolean isNumeric() {
            for (Value v : items) {
                if (!(v instanceof Num)) return false;
            }
            return true;
        }

        /** Element values; callers check {@link #isNumeric()} first. */
        public double[] numbers() {
            double[] out = new double[items.size()];
            for (int i = 0; i < out.length; i++) out[i] = ((Num) items.get(i)).value;
            return out;
        }

        @Override
        public boolean isResolved() {
            for (Value v : items) {
                if (!v.isResolved()) return false;
            }
            return true;
        }

        @Override
        public JsonNode toJson() {
            ArrayNode arr = JsonNodeFactory.instance.arrayNode(items.size());
            for (Value v : items) arr.add(v.toJson());
            return arr;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Vec v && v.items.equals(items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return toJson().toString();
        }
    }

    /** Digest text produced by {@code hash}. */
    final class Text implements Value {
        public final String value;

        Text(String value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.textNode(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Text t && t.value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /** {@code update(target, value)}: carried as data, never applied by the evaluator. */
    final class PendingUpdate implements Value {
        public final String target;
        public final Value value;

        public PendingUpdate(String target, Value value) {
            this.target = Objects.requireNonNull(target, "target");
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public JsonNode toJson() {
            ObjectNode o = JsonNodeFactory.instance.objectNode();
            o.put("_update", target);
            o.set("value", value.toJson());
            return o;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof PendingUpdate p && p.target.equals(target) && p.value.equals(value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(target, value);
        }

        @Override
        public String toString() {
            return toJson().toString();
        }
    }

    /** Unresolved identifier, kept by name. */
    final class Symbol implements Value {
        public final String name;

        Symbol(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.textNode(name);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Symbol s && s.name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** Uninterpreted call record. */
    final class Call implements Value {
        public final String name;
        public final List<Value> args;

        public Call(String name, List<? extends Value> args) {
            this.name = Objects.requireNonNull(name, "name");
            this.args = List.copyOf(args);
        }

        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public JsonNode toJson() {
            ObjectNode o = JsonNodeFactory.instance.objectNode();
            o.put("_call", name);
            ArrayNode arr = o.putArray("args");
            for (Value v : args) arr.add(v.toJson());
            return o;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Call c && c.name.equals(name) && c.args.equals(args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, args);
        }

        @Override
        public String toString() {
            List<String> parts = new ArrayList<>(args.size());
            for (Value v : args) parts.add(String.valueOf(v));
            return name + "(" + String.join(", ", parts) + ")";
        }
    }
}
