package com.formulize.compute.registry;

import com.formulize.compute.api.Role;

/**
 * Receives registry mutations that require the active strategy to react.
 * Implemented by the computation dispatcher.
 */
public interface RegistryObserver {

    /**
     * A user-owned value changed and the registry is not in bulk mode.
     */
    void onValueChanged(String variableId);

    /**
     * A variable's role changed; the evaluator must be re-derived.
     */
    void onRoleChanged(String variableId, Role role);

    /**
     * @return true while a recompute pass is running.
     */
    boolean isRecomputing();
}
