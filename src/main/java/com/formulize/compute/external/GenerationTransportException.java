package com.formulize.compute.external;

import com.formulize.compute.api.ComputationException;

/**
 * The generation service could not be reached or answered with a non-2xx
 * status.
 */
public class GenerationTransportException extends ComputationException {
    private final int statusCode;

    public GenerationTransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GenerationTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }
}
