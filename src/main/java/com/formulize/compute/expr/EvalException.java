package com.formulize.compute.expr;

import com.formulize.compute.api.ComputationException;

/**
 * Parsing or evaluating an expression failed: a syntax error, a construct
 * outside the grammar, an undefined symbol or a type mismatch.
 */
public class EvalException extends ComputationException {

    public EvalException(String message) {
        super(message);
    }
}
