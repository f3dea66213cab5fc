package com.formulize.compute.api;

import java.util.Map;

/**
 * Everything a manual function may touch during a single invocation.
 */
public interface ManualContext {

    /** Read/write access to variables by id. */
    VariableAccessor vars();

    /**
     * Appends a point to the ordered point list of a graph.
     *
     * @param graphId     The graph the point belongs to.
     * @param coordinates Coordinate name to value, e.g. {@code {x: 1, y: 2}}.
     */
    void collect(String graphId, Map<String, Double> coordinates);

    /**
     * Records a step applying to all formulas. Ignored unless step recording
     * was requested for this invocation.
     */
    void step(String description, Map<String, Value> values);

    /**
     * Records a step with one view per formula id. Ignored unless step
     * recording was requested for this invocation.
     *
     * @param id    Optional step identifier, may be null.
     * @param views Per-formula views keyed by formula id.
     */
    void stepViews(String id, Map<String, StepView> views);
}
