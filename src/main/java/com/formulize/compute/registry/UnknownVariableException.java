package com.formulize.compute.registry;

import com.formulize.compute.api.ComputationException;

/**
 * An operation referenced a variable id that is not registered.
 */
public class UnknownVariableException extends ComputationException {
    private final String variableId;

    public UnknownVariableException(String variableId) {
        super("Unknown variable: " + variableId);
        this.variableId = variableId;
    }

    public String variableId() {
        return variableId;
    }
}
