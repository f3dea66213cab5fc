package com.formulize.compute.manual;

import com.formulize.compute.api.Evaluator;
import com.formulize.compute.api.ManualFunction;
import com.formulize.compute.api.Value;

import java.util.List;
import java.util.Map;

/**
 * Evaluator for the manual strategy. The snapshot argument is not used: the
 * functions read and write the live registry through the sandbox.
 */
public final class ManualEvaluator implements Evaluator {
    private final ManualSandbox sandbox;
    private final List<ManualFunction> functions;
    private ManualResult lastResult;

    public ManualEvaluator(ManualSandbox sandbox, List<ManualFunction> functions) {
        this.sandbox = sandbox;
        this.functions = List.copyOf(functions);
    }

    @Override
    public Map<String, Value> evaluate(Map<String, Value> variables) {
        lastResult = sandbox.execute(functions, false);
        return lastResult.values();
    }

    /** Result of the most recent evaluation, or null before the first. */
    public ManualResult lastResult() {
        return lastResult;
    }

    public List<ManualFunction> functions() {
        return functions;
    }
}
