package com.formulize.compute.expr;

import java.util.Map;
import java.util.Set;

/**
 * A node of a parsed expression. Nodes are immutable and may be evaluated
 * repeatedly against different scopes.
 */
public interface ExprNode {

    /**
     * @param scope Symbol values by name.
     * @return The value of this node.
     * @throws EvalException for undefined symbols, type mismatches or
     *                       out-of-range indices.
     */
    EvalValue eval(Map<String, EvalValue> scope);

    /** Adds every symbol this node reads to {@code out}. */
    void collectSymbols(Set<String> out);
}
