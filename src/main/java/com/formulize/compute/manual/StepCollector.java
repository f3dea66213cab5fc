package com.formulize.compute.manual;

import com.formulize.compute.api.StepView;
import com.formulize.compute.api.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records {@link CollectedStep}s when enabled; otherwise every call is
 * ignored.
 */
public final class StepCollector {
    private final boolean enabled;
    private final List<CollectedStep> steps = new ArrayList<>();

    public StepCollector(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void record(String description, Map<String, Value> values) {
        if (!enabled)
            return;
        Map<String, Value> copy = values != null ? values : Map.of();
        steps.add(new CollectedStep(steps.size(), null, description, copy,
                Map.of(CollectedStep.ALL_FORMULAS, new StepView(description, copy))));
    }

    public void recordViews(String id, Map<String, StepView> views) {
        if (!enabled || views == null || views.isEmpty())
            return;
        Map<String, Value> merged = new LinkedHashMap<>();
        String description = null;
        for (StepView view : views.values()) {
            merged.putAll(view.values());
            if (description == null)
                description = view.description();
        }
        steps.add(new CollectedStep(steps.size(), id, description, merged, views));
    }

    public List<CollectedStep> steps() {
        return Collections.unmodifiableList(steps);
    }
}
