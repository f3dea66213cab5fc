package com.formulize.compute.api;

import java.util.Map;

/**
 * The currently active evaluation function.
 *
 * Exactly one strategy produces the evaluator at a time. It receives a snapshot
 * of every variable value, keyed by variable id, and returns values for the
 * computed variables it could derive. Variables it could not derive are either
 * absent from the result or reported as {@link Value#NaN}.
 */
@FunctionalInterface
public interface Evaluator {

    /**
     * @param variables Snapshot of all defined variable values.
     * @return Computed values keyed by variable id.
     */
    Map<String, Value> evaluate(Map<String, Value> variables);
}
