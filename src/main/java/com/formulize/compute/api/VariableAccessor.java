package com.formulize.compute.api;

import java.util.Set;

/**
 * Read/write view of variables by id, handed to manual functions.
 *
 * Reads of unknown ids return {@code null}. Writes to known ids take effect on
 * the underlying variable immediately; writes to unknown ids are ignored.
 */
public interface VariableAccessor {

    Value get(String id);

    /**
     * @return true if the variable exists and was written.
     */
    boolean set(String id, Value value);

    Set<String> ids();

    /**
     * Reads a scalar, returning NaN for unknown or set-valued variables.
     */
    default double getDouble(String id) {
        Value v = get(id);
        return v != null && v.isScalar() ? v.doubleValue() : Double.NaN;
    }

    default boolean set(String id, double value) {
        return set(id, Value.of(value));
    }
}
