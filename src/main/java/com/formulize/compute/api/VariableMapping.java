package com.formulize.compute.api;

import java.util.Map;

/**
 * Direct per-variable override for the symbolic strategy. When a computed
 * variable declares a mapping, it is used instead of any equation that would
 * also define the variable.
 */
@FunctionalInterface
public interface VariableMapping {

    /**
     * @param scope Current values keyed by original variable id, including
     *              computed values resolved earlier in the same evaluation.
     * @return The value of the mapped variable.
     */
    Value apply(Map<String, Value> scope);
}
