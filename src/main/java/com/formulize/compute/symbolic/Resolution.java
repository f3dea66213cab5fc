package com.formulize.compute.symbolic;

import com.formulize.compute.api.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one fixed-point resolution.
 *
 * @param values     Value per target id; unresolved targets map to
 *                   {@link Value#NaN}.
 * @param unresolved Targets no equation or mapping could derive.
 * @param passes     Number of passes run.
 */
public record Resolution(Map<String, Value> values, Set<String> unresolved, int passes) {

    public Resolution {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        unresolved = Collections.unmodifiableSet(new LinkedHashSet<>(unresolved));
    }

    public boolean complete() {
        return unresolved.isEmpty();
    }
}
