package com.formulize.compute.manual;

import com.formulize.compute.api.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one sandbox execution produced.
 *
 * @param values   Current value of every computed variable after the run.
 * @param points   Plot points by graph id.
 * @param steps    Recorded steps, empty unless recording was requested.
 * @param failures Exceptions thrown, keyed by the index of the function.
 */
public record ManualResult(Map<String, Value> values, Map<String, List<Map<String, Double>>> points,
        List<CollectedStep> steps, Map<Integer, Exception> failures) {

    public ManualResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        steps = List.copyOf(steps);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean failed() {
        return !failures.isEmpty();
    }
}
