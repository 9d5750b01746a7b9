package org.calista.formal.lang.eval;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.calista.formal.lang.commit.Fingerprinter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed set of built-in functions. A function returns {@code null} when its arguments do not
 * have the expected shape; the caller then degrades to an uninterpreted {@link Value.Call}.
 */
public final class Builtins {

    @FunctionalInterface
    interface Fn {
        Value apply(List<Value> args);
    }

    private final Map<String, Fn> fns = new HashMap<>();

    public Builtins(Fingerprinter fingerprinter) {
        Objects.requireNonNull(fingerprinter, "fingerprinter");

        fns.put("sum", Builtins::sum);
        fns.put("dot", Builtins::dot);
        fns.put("norm", args -> {
            double[] v = numericVec(args, 0);
            return v == null ? null : Value.num(magnitude(v));
        });
        fns.put("scale", args -> {
            double[] v = numericVec(args, 0);
            Double k = number(args, 1);
            if (v == null || k == null) return null;
            List<Value> out = new ArrayList<>(v.length);
            for (double x : v) out.add(Value.num(x * k));
            return Value.vec(out);
        });
        fns.put("add", Builtins::add);
        fns.put("mul", args -> {
            Double a = number(args, 0);
            Double b = number(args, 1);
            return (a == null || b == null) ? null : Value.num(a * b);
        });
        fns.put("min", args -> extreme(args, true));
        fns.put("max", args -> extreme(args, false));
        fns.put("abs", args -> {
            Double a = number(args, 0);
            return a == null ? null : Value.num(Math.abs(a));
        });
        fns.put("sqrt", args -> {
            Double a = number(args, 0);
            return (a == null || a < 0) ? null : Value.num(Math.sqrt(a));
        });
        fns.put("hash", args -> {
            ArrayNode arr = JsonNodeFactory.instance.arrayNode(args.size());
            for (Value v : args) arr.add(v.toJson());
            return Value.text(fingerprinter.fingerprint(arr));
        });
    }

    Set<String> names() {
        return Set.copyOf(fns.keySet());
    }

    boolean isBuiltin(String name) {
        return fns.containsKey(name);
    }

    /**
     * Applies a built-in, or returns a symbolic call for unknown names / ill-shaped arguments.
     */
    public Value call(String name, List<Value> args) {
        Fn fn = fns.get(name);
        Value out = fn == null ? null : fn.apply(args);
        return out != null ? out : new Value.Call(name, args);
    }

    // ---------------------------------------------------------------------
    // functions
    // ---------------------------------------------------------------------

    /** Numbers add directly; a numeric vector contributes the sum of its elements. */
    private static Value sum(List<Value> args) {
        double total = 0.0;
        for (Value v : args) {
            if (v instanceof Value.Num n) {
                total += n.value;
            } else if (v instanceof Value.Vec vec && vec.isNumeric()) {
                for (double x : vec.numbers()) total += x;
            } else {
                return null;
            }
        }
        return Value.num(total);
    }

    /** Missing or non-numeric elements of the second vector count as 0. */
    private static Value dot(List<Value> args) {
        double[] a = numericVec(args, 0);
        if (a == null || args.size() < 2 || !(args.get(1) instanceof Value.Vec b)) return null;
        double s = 0.0;
        for (int i = 0; i < a.length; i++) s += a[i] * elementOrZero(b, i);
        return Value.num(s);
    }

    private static Value add(List<Value> args) {
        double[] a = numericVec(args, 0);
        if (a == null || args.size() < 2 || !(args.get(1) instanceof Value.Vec b)) return null;
        List<Value> out = new ArrayList<>(a.length);
        for (int i = 0; i < a.length; i++) out.add(Value.num(a[i] + elementOrZero(b, i)));
        return Value.vec(out);
    }

    private static Value extreme(List<Value> args, boolean min) {
        if (args.isEmpty()) return null;
        double best = min ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        for (Value v : args) {
            if (!(v instanceof Value.Num n)) return null;
            best = min ? Math.min(best, n.value) : Math.max(best, n.value);
        }
        return Value.num(best);
    }

    // ---------------------------------------------------------------------
    // shape helpers
    // ---------------------------------------------------------------------

    public static double magnitude(double[] v) {
        double s = 0.0;
        for (double x : v) s += x * x;
        return Math.sqrt(s);
    }

    private static Double number(List<Value> args, int idx) {
        if (idx >= args.size()) return null;
        return args.get(idx) instanceof Value.Num n ? n.value : null;
    }

    private static double[] numericVec(List<Value> args, int idx) {
        if (idx >= args.size()) return null;
        if (args.get(idx) instanceof Value.Vec v && v.isNumeric()) return v.numbers();
        return null;
    }

    private static double elementOrZero(Value.Vec v, int i) {
        if (i >= v.items.size()) return 0.0;
        return v.items.get(i) instanceof Value.Num n ? n.value : 0.0;
    }
}
