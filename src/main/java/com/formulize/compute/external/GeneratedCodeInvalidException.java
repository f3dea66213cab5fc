package com.formulize.compute.external;

import com.formulize.compute.api.ComputationException;

/**
 * Generated function text failed validation or could not be compiled into the
 * restricted evaluator language. The previous evaluator stays active.
 */
public class GeneratedCodeInvalidException extends ComputationException {

    public GeneratedCodeInvalidException(String message) {
        super(message);
    }

    public GeneratedCodeInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
