package com.formulize.compute.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a recorded step shows: a description, the variable values to stage and
 * an optional expression to highlight.
 */
public record StepView(String description, Map<String, Value> values, String expression) {

    public StepView {
        if (description == null)
            description = "";
        values = values == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public StepView(String description, Map<String, Value> values) {
        this(description, values, null);
    }
}
