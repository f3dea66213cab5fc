package com.formulize.compute.expr;

import com.formulize.compute.api.Value;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Runtime value of the expression language: a scalar or a numeric vector.
 * Booleans are represented as 1 and 0.
 */
public final class EvalValue {
    public static final EvalValue TRUE = new EvalValue(1, null);
    public static final EvalValue FALSE = new EvalValue(0, null);

    private final double scalar;
    private final double[] vector;

    private EvalValue(double scalar, double[] vector) {
        this.scalar = scalar;
        this.vector = vector;
    }

    public static EvalValue of(double scalar) {
        return new EvalValue(scalar, null);
    }

    /** Wraps the array; the caller must not modify it afterwards. */
    public static EvalValue ofVector(double[] vector) {
        return new EvalValue(Double.NaN, vector);
    }

    public static EvalValue of(boolean b) {
        return b ? TRUE : FALSE;
    }

    /**
     * Converts a variable value. Sets must be numeric.
     *
     * @throws EvalException for sets holding non-numeric elements.
     */
    public static EvalValue from(Value value) {
        if (value.isScalar())
            return of(value.doubleValue());
        if (!value.isNumericSet())
            throw new EvalException("Set " + value + " is not numeric");
        return ofVector(value.toDoubleArray());
    }

    public Value toValue() {
        return vector == null ? Value.of(scalar) : Value.ofVector(vector);
    }

    public boolean isVector() {
        return vector != null;
    }

    public double scalar() {
        if (vector != null)
            throw new EvalException("Expected a scalar but got a vector of length " + vector.length);
        return scalar;
    }

    public double[] vector() {
        if (vector == null)
            throw new EvalException("Expected a vector but got scalar " + scalar);
        return vector;
    }

    public int length() {
        return vector == null ? 1 : vector.length;
    }

    /** Zero and NaN are false. Vectors have no truth value. */
    public boolean truthy() {
        double d = scalar();
        return d != 0 && !Double.isNaN(d);
    }

    // ── Arithmetic ───────────────────────────────────────────────

    public EvalValue map(DoubleUnaryOperator op) {
        if (vector == null)
            return of(op.applyAsDouble(scalar));
        double[] out = new double[vector.length];
        for (int i = 0; i < out.length; i++)
            out[i] = op.applyAsDouble(vector[i]);
        return ofVector(out);
    }

    /**
     * Applies an operator element-wise, broadcasting scalars over vectors.
     *
     * @throws EvalException if both operands are vectors of different length.
     */
    public static EvalValue elementWise(EvalValue a, EvalValue b, DoubleBinaryOperator op) {
        if (a.vector == null && b.vector == null)
            return of(op.applyAsDouble(a.scalar, b.scalar));
        if (a.vector != null && b.vector != null && a.vector.length != b.vector.length)
            throw new EvalException("Dimension mismatch: " + a.vector.length + " vs " + b.vector.length);
        int n = a.vector != null ? a.vector.length : b.vector.length;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double x = a.vector != null ? a.vector[i] : a.scalar;
            double y = b.vector != null ? b.vector[i] : b.scalar;
            out[i] = op.applyAsDouble(x, y);
        }
        return ofVector(out);
    }

    public static double dot(double[] a, double[] b) {
        if (a.length != b.length)
            throw new EvalException("Dimension mismatch: " + a.length + " vs " + b.length);
        double sum = 0;
        for (int i = 0; i < a.length; i++)
            sum += a[i] * b[i];
        return sum;
    }

    public boolean sameAs(EvalValue other) {
        if (vector == null)
            return other.vector == null && scalar == other.scalar;
        return Arrays.equals(vector, other.vector);
    }

    @Override
    public String toString() {
        return vector == null ? Double.toString(scalar) : Arrays.toString(vector);
    }
}
