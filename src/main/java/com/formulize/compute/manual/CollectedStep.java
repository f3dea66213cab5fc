package com.formulize.compute.manual;

import com.formulize.compute.api.StepView;
import com.formulize.compute.api.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A checkpoint recorded by a manual function in step mode.
 *
 * @param index          Position in the recording, from 0.
 * @param id             Optional identifier given by the function, may be
 *                       null.
 * @param description    Text shown for the step, may be null.
 * @param values         Union of the values of every view.
 * @param targetFormulas Views keyed by formula id; the empty key applies to
 *                       every formula.
 */
public record CollectedStep(int index, String id, String description, Map<String, Value> values,
        Map<String, StepView> targetFormulas) {

    /** Key of a view that applies to every formula. */
    public static final String ALL_FORMULAS = "";

    public CollectedStep {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        targetFormulas = Collections.unmodifiableMap(new LinkedHashMap<>(targetFormulas));
    }

    /**
     * The view for a formula, falling back to the one for every formula.
     *
     * @return The view, or null if the step does not apply to the formula.
     */
    public StepView viewFor(String formulaId) {
        StepView view = targetFormulas.get(formulaId);
        return view != null ? view : targetFormulas.get(ALL_FORMULAS);
    }
}
