package com.formulize.compute.api;

/**
 * Observability and change notification for recompute passes.
 *
 * Consumers (UI bindings, plots, loggers) subscribe explicitly instead of
 * intercepting property access. Callbacks run synchronously on the thread
 * performing the recompute, so implementations must be cheap and must not
 * block.
 */
public interface ComputationListener {

    /**
     * Called before the active evaluator is invoked.
     *
     * @param epoch The incrementing pass number.
     */
    void onRecomputeStart(long epoch);

    /**
     * Called after a computed variable accepted a new result.
     *
     * @param epoch      Current pass number.
     * @param variableId The variable id.
     * @param value      The accepted value.
     * @param changed    false if the value equals the previous one.
     */
    void onVariableComputed(long epoch, String variableId, Value value, boolean changed);

    /**
     * Called when a computed variable could not be derived. Its value is left
     * unchanged and flagged errored.
     *
     * @param epoch      Current pass number.
     * @param variableId The variable id.
     * @param error      The reason.
     */
    void onVariableError(long epoch, String variableId, Throwable error);

    /**
     * Called when the pass is complete.
     *
     * @param epoch            Current pass number.
     * @param variablesUpdated Number of computed variables that accepted a
     *                         result.
     */
    void onRecomputeEnd(long epoch, int variablesUpdated);
}
