package com.formulize.compute.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The value held by a variable: either a single number or an ordered list of
 * set elements (numbers or strings). A value is never both at once.
 *
 * Set elements are normalized on construction: every {@link Number} becomes a
 * {@link Double}, everything else its string form. This keeps positional
 * lookups ({@link #indexOf(Value)}) independent of the boxed type the caller
 * happened to use.
 *
 * Instances are immutable.
 */
public final class Value {

    /** The "not-a-number" sentinel reported for unresolved variables. */
    public static final Value NaN = new Value(Double.NaN, null);

    private final double scalar;
    private final List<Object> elements;

    private Value(double scalar, List<Object> elements) {
        this.scalar = scalar;
        this.elements = elements;
    }

    public static Value of(double scalar) {
        return new Value(scalar, null);
    }

    /**
     * Creates a set-valued value.
     *
     * @param elements The ordered elements; numbers are stored as doubles.
     * @return The new value.
     */
    public static Value ofSet(List<?> elements) {
        if (elements == null)
            throw new IllegalArgumentException("Set elements must not be null");
        List<Object> copy = new ArrayList<>(elements.size());
        for (Object e : elements)
            copy.add(normalize(e));
        return new Value(Double.NaN, Collections.unmodifiableList(copy));
    }

    public static Value ofVector(double[] values) {
        List<Object> copy = new ArrayList<>(values.length);
        for (double v : values)
            copy.add(v + 0.0);
        return new Value(Double.NaN, Collections.unmodifiableList(copy));
    }

    /**
     * Converts a loosely typed value (as found in JSON or user code) into a
     * {@link Value}. Numbers become scalars, lists and arrays become sets.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Value from(Object raw) {
        if (raw == null)
            return null;
        if (raw instanceof Value v)
            return v;
        if (raw instanceof Number n)
            return of(n.doubleValue());
        if (raw instanceof double[] arr)
            return ofVector(arr);
        if (raw instanceof List<?> list)
            return ofSet(list);
        if (raw instanceof Object[] arr) {
            List<Object> list = new ArrayList<>(arr.length);
            Collections.addAll(list, arr);
            return ofSet(list);
        }
        if (raw instanceof String s)
            return of(parseElement(s));
        throw new IllegalArgumentException("Unsupported value type: " + raw.getClass().getName());
    }

    /**
     * Converts a set element into a scalar value. Strings are parsed as numbers
     * and yield NaN when they are not numeric.
     */
    public static Value fromElement(Object element) {
        if (element instanceof Number n)
            return of(n.doubleValue());
        return of(parseElement(String.valueOf(element)));
    }

    static Object normalize(Object element) {
        // adding 0.0 folds -0.0 into 0.0
        if (element instanceof Number n)
            return n.doubleValue() + 0.0;
        return String.valueOf(element);
    }

    private static double parseElement(String s) {
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    public boolean isScalar() {
        return elements == null;
    }

    public boolean isSet() {
        return elements != null;
    }

    /**
     * @return The scalar value.
     * @throws IllegalStateException if this value is a set.
     */
    public double doubleValue() {
        if (elements != null)
            throw new IllegalStateException("Value is a set, not a scalar: " + this);
        return scalar;
    }

    /**
     * @return The unmodifiable list of set elements.
     * @throws IllegalStateException if this value is a scalar.
     */
    public List<Object> elements() {
        if (elements == null)
            throw new IllegalStateException("Value is a scalar, not a set: " + this);
        return elements;
    }

    public int size() {
        return elements == null ? 1 : elements.size();
    }

    /** True for sets whose every element is a number. */
    public boolean isNumericSet() {
        if (elements == null)
            return false;
        for (Object e : elements) {
            if (!(e instanceof Double))
                return false;
        }
        return true;
    }

    public double[] toDoubleArray() {
        if (!isNumericSet())
            throw new IllegalStateException("Value is not a numeric set: " + this);
        double[] out = new double[elements.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = (Double) elements.get(i);
        return out;
    }

    /**
     * A value the engine accepts as a computation result: a finite number, or a
     * set whose numeric elements are all finite.
     */
    public boolean isValid() {
        if (elements == null)
            return Double.isFinite(scalar);
        for (Object e : elements) {
            if (e instanceof Double d && !Double.isFinite(d))
                return false;
        }
        return true;
    }

    /**
     * Finds the position of a scalar value inside this set.
     *
     * @param needle The value to look for; only scalars can be found.
     * @return The index, or -1 if absent or if this value is not a set.
     */
    public int indexOf(Value needle) {
        if (elements == null || needle == null || needle.isSet())
            return -1;
        for (int i = 0; i < elements.size(); i++) {
            Object e = elements.get(i);
            if (e instanceof Double d) {
                if (sameScalar(d, needle.scalar))
                    return i;
            } else {
                double parsed = parseElement((String) e);
                if (!Double.isNaN(parsed) && parsed == needle.scalar)
                    return i;
            }
        }
        return -1;
    }

    /** Numeric equality, except that NaN equals NaN. */
    private static boolean sameScalar(double a, double b) {
        return a == b || (Double.isNaN(a) && Double.isNaN(b));
    }

    @JsonValue
    public Object toJson() {
        return elements == null ? (Object) scalar : elements;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Value other))
            return false;
        if (elements == null)
            return other.elements == null && sameScalar(scalar, other.scalar);
        return elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        // -0.0 hashes like 0.0
        return elements == null ? Double.hashCode(scalar == 0 ? 0.0 : scalar) : elements.hashCode();
    }

    @Override
    public String toString() {
        return elements == null ? Double.toString(scalar) : elements.toString();
    }
}
