package com.formulize.compute.expr;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

/**
 * The fixed set of functions and constants the expression language can call.
 * Nothing outside this table is reachable from an expression.
 *
 * Unary math functions apply element-wise to vectors.
 */
public final class FunctionTable {
    private static final Map<String, Fn> FUNCTIONS = new HashMap<>();
    private static final Map<String, Double> CONSTANTS = new HashMap<>();

    /** A callable entry. */
    public interface Fn {
        String name();

        int minArgs();

        /** -1 for unbounded. */
        int maxArgs();

        EvalValue call(EvalValue[] args);

        /** Checks arity, then calls. */
        default EvalValue apply(EvalValue[] args) {
            if (args.length < minArgs() || (maxArgs() >= 0 && args.length > maxArgs()))
                throw new EvalException("Wrong number of arguments for " + name() + ": " + args.length);
            return call(args);
        }
    }

    private record Entry(String name, int minArgs, int maxArgs, Function<EvalValue[], EvalValue> body)
            implements Fn {
        @Override
        public EvalValue call(EvalValue[] args) {
            return body.apply(args);
        }
    }

    static {
        CONSTANTS.put("pi", Math.PI);
        CONSTANTS.put("PI", Math.PI);
        CONSTANTS.put("e", Math.E);
        CONSTANTS.put("E", Math.E);
        CONSTANTS.put("tau", 2 * Math.PI);
        CONSTANTS.put("NaN", Double.NaN);
        CONSTANTS.put("Infinity", Double.POSITIVE_INFINITY);

        unary("sin", Math::sin);
        unary("cos", Math::cos);
        unary("tan", Math::tan);
        unary("asin", Math::asin);
        unary("acos", Math::acos);
        unary("atan", Math::atan);
        unary("sinh", Math::sinh);
        unary("cosh", Math::cosh);
        unary("tanh", Math::tanh);
        unary("sqrt", Math::sqrt);
        unary("cbrt", Math::cbrt);
        unary("abs", Math::abs);
        unary("exp", Math::exp);
        unary("log10", Math::log10);
        unary("log2", d -> Math.log(d) / Math.log(2));
        unary("floor", Math::floor);
        unary("ceil", Math::ceil);
        unary("round", d -> (double) Math.round(d));
        unary("sign", Math::signum);
        unary("trunc", d -> d < 0 ? Math.ceil(d) : Math.floor(d));

        binary("atan2", Math::atan2);
        binary("pow", Math::pow);
        binary("hypot", Math::hypot);

        register("log", 1, 2, args -> args.length == 1
                ? args[0].map(Math::log)
                : EvalValue.elementWise(args[0], args[1], (x, base) -> Math.log(x) / Math.log(base)));
        register("isNaN", 1, 1, args -> EvalValue.of(Double.isNaN(args[0].scalar())));
        register("isFinite", 1, 1, args -> EvalValue.of(Double.isFinite(args[0].scalar())));

        register("min", 1, -1, args -> EvalValue.of(fold(args, Double.POSITIVE_INFINITY, Math::min)));
        register("max", 1, -1, args -> EvalValue.of(fold(args, Double.NEGATIVE_INFINITY, Math::max)));
        register("sum", 1, -1, args -> EvalValue.of(fold(args, 0, Double::sum)));
        register("mean", 1, -1, args -> EvalValue.of(fold(args, 0, Double::sum) / count(args)));
        register("norm", 1, 1, args -> {
            double[] v = args[0].isVector() ? args[0].vector() : new double[] { args[0].scalar() };
            return EvalValue.of(Math.sqrt(EvalValue.dot(v, v)));
        });
        register("dot", 2, 2, args -> EvalValue.of(EvalValue.dot(args[0].vector(), args[1].vector())));
        register("cross", 2, 2, args -> {
            double[] a = args[0].vector();
            double[] b = args[1].vector();
            if (a.length != 3 || b.length != 3)
                throw new EvalException("cross requires two vectors of length 3");
            return EvalValue.ofVector(new double[] {
                    a[1] * b[2] - a[2] * b[1],
                    a[2] * b[0] - a[0] * b[2],
                    a[0] * b[1] - a[1] * b[0] });
        });
    }

    private FunctionTable() {
    }

    private static void register(String name, int min, int max,
            Function<EvalValue[], EvalValue> body) {
        FUNCTIONS.put(name, new Entry(name, min, max, body));
    }

    private static void unary(String name, DoubleUnaryOperator op) {
        register(name, 1, 1, args -> args[0].map(op));
    }

    private static void binary(String name, DoubleBinaryOperator op) {
        register(name, 2, 2, args -> EvalValue.elementWise(args[0], args[1], op));
    }

    /** Folds every scalar argument and every element of every vector argument. */
    private static double fold(EvalValue[] args, double identity, DoubleBinaryOperator op) {
        double acc = identity;
        for (EvalValue a : args) {
            if (a.isVector()) {
                for (double d : a.vector())
                    acc = op.applyAsDouble(acc, d);
            } else {
                acc = op.applyAsDouble(acc, a.scalar());
            }
        }
        return acc;
    }

    private static int count(EvalValue[] args) {
        int n = 0;
        for (EvalValue a : args)
            n += a.length();
        return n;
    }

    /** @return The function, or null if the name is not in the table. */
    public static Fn lookup(String name) {
        return FUNCTIONS.get(name);
    }

    /** @return The constant's value, or null if the name is not a constant. */
    public static Double constant(String name) {
        return CONSTANTS.get(name);
    }

    public static Set<String> functionNames() {
        return Collections.unmodifiableSet(FUNCTIONS.keySet());
    }
}
