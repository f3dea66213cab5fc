package com.formulize.compute.engine;

import com.formulize.compute.api.StepView;
import com.formulize.compute.api.Value;
import com.formulize.compute.manual.CollectedStep;
import com.formulize.compute.manual.ManualResult;
import com.formulize.compute.registry.Variable;
import com.formulize.compute.registry.VariableRegistry;

import lombok.extern.log4j.Log4j2;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives step mode: samples the manual functions once with step recording and
 * walks the recorded steps with a cursor. Every move stages the step's values
 * into the registry; nothing is recomputed.
 */
@Log4j2
public final class StepController {
    private final VariableRegistry registry;
    private final ComputationDispatcher dispatcher;

    private List<CollectedStep> steps = List.of();
    private int cursor = -1;
    private String stepError;

    public StepController(VariableRegistry registry, ComputationDispatcher dispatcher) {
        this.registry = registry;
        this.dispatcher = dispatcher;
    }

    /**
     * Runs the manual functions with recording and moves to the first step.
     *
     * @return The recorded steps.
     */
    public List<CollectedStep> sample() {
        stepError = null;
        if (dispatcher.manualFunctions().isEmpty()) {
            stepError = "No manual functions to sample";
            log.warn(stepError);
            clearSteps();
            return steps;
        }
        ManualResult result = dispatcher.sandbox().execute(dispatcher.manualFunctions(), true);
        if (result.failed()) {
            Exception first = result.failures().values().iterator().next();
            stepError = first.getMessage() != null ? first.getMessage() : first.getClass().getSimpleName();
        }
        steps = result.steps();
        registry.clearProcessedIndices();
        cursor = steps.isEmpty() ? -1 : 0;
        log.info("Sampled {} step(s)", steps.size());
        if (cursor >= 0)
            applyCurrentStep();
        return steps;
    }

    public boolean next() {
        return goTo(cursor + 1);
    }

    public boolean previous() {
        return goTo(cursor - 1);
    }

    public boolean goToStart() {
        return goTo(0);
    }

    public boolean goToEnd() {
        return goTo(steps.size() - 1);
    }

    /**
     * Moves the cursor and stages the step.
     *
     * @return false if the index is outside the recording.
     */
    public boolean goTo(int index) {
        if (index < 0 || index >= steps.size())
            return false;
        cursor = index;
        applyCurrentStep();
        return true;
    }

    /**
     * Stages the current step's values. Staged set members also update the
     * variable's active and processed indices.
     *
     * @return Ids of the variables that were staged.
     */
    public Set<String> applyCurrentStep() {
        CollectedStep step = currentStep();
        if (step == null)
            return Set.of();
        Set<String> staged = new LinkedHashSet<>();
        for (Map.Entry<String, Value> e : step.values().entrySet()) {
            if (e.getValue() == null || !registry.stageValue(e.getKey(), e.getValue()))
                continue;
            staged.add(e.getKey());
            Variable variable = registry.require(e.getKey());
            if (variable.set() != null && e.getValue().isScalar()) {
                int index = Value.ofSet(variable.set()).indexOf(e.getValue());
                if (index >= 0) {
                    registry.setActiveIndex(e.getKey(), index);
                    registry.addProcessedIndex(e.getKey(), index);
                }
            }
        }
        return staged;
    }

    /**
     * Variables touched by the current step, per formula id. The empty key
     * stands for every formula.
     */
    public Map<String, Set<String>> activeVariables() {
        CollectedStep step = currentStep();
        if (step == null)
            return Map.of();
        Map<String, Set<String>> active = new LinkedHashMap<>();
        for (Map.Entry<String, StepView> e : step.targetFormulas().entrySet())
            active.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue().values().keySet())));
        return Collections.unmodifiableMap(active);
    }

    public CollectedStep currentStep() {
        return cursor >= 0 && cursor < steps.size() ? steps.get(cursor) : null;
    }

    public List<CollectedStep> steps() {
        return steps;
    }

    public int cursor() {
        return cursor;
    }

    public boolean hasNext() {
        return cursor + 1 < steps.size();
    }

    public boolean hasPrevious() {
        return cursor > 0;
    }

    /** Message of the first failure of the last sample, or null. */
    public String stepError() {
        return stepError;
    }

    public void clearSteps() {
        steps = List.of();
        cursor = -1;
        registry.clearActiveIndices();
        registry.clearProcessedIndices();
    }
}
