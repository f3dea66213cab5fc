package com.formulize.compute.manual;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered plot points per graph id, filled by manual functions through
 * {@code collect}.
 */
public final class PointCollector {
    private final Map<String, List<Map<String, Double>>> points = new LinkedHashMap<>();

    public void collect(String graphId, Map<String, Double> coordinates) {
        if (graphId == null || coordinates == null)
            return;
        points.computeIfAbsent(graphId, k -> new ArrayList<>())
                .add(Collections.unmodifiableMap(new LinkedHashMap<>(coordinates)));
    }

    public List<Map<String, Double>> points(String graphId) {
        List<Map<String, Double>> list = points.get(graphId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /** Detached copy of every graph's points. */
    public Map<String, List<Map<String, Double>>> snapshot() {
        Map<String, List<Map<String, Double>>> copy = new LinkedHashMap<>();
        points.forEach((graph, list) -> copy.put(graph, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }

    public void clear() {
        points.clear();
    }
}
