package com.formulize.compute.engine;

import com.formulize.compute.api.ComputationException;

/**
 * A computation cannot be set up: no computed variables, no expressions, or no
 * manual functions for the selected strategy. The previously installed
 * evaluator stays active.
 */
public class ConfigurationException extends ComputationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
