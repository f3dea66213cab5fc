package com.formulize.compute.manual;

import com.formulize.compute.api.ManualContext;
import com.formulize.compute.api.ManualFunction;
import com.formulize.compute.api.Role;
import com.formulize.compute.api.StepView;
import com.formulize.compute.api.Value;
import com.formulize.compute.api.VariableAccessor;
import com.formulize.compute.registry.Variable;
import com.formulize.compute.registry.VariableRegistry;
import com.formulize.compute.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs manual functions against the live registry.
 *
 * Every function is invoked exactly once per execution, each inside its own
 * try/catch: a function that throws contributes nothing further but never
 * stops the others. Afterwards the computed variables are re-read, so values
 * written before a failure are kept.
 */
public final class ManualSandbox {
    private static final Logger log = LogManager.getLogger(ManualSandbox.class);

    private final VariableRegistry registry;
    private final RegistryView view;
    private final ErrorRateLimiter errors = new ErrorRateLimiter(log, 1000);

    public ManualSandbox(VariableRegistry registry) {
        this.registry = registry;
        this.view = new RegistryView(registry);
    }

    public VariableAccessor view() {
        return view;
    }

    /**
     * @param functions   The functions, run in order.
     * @param recordSteps Whether {@code step(...)} calls are recorded.
     * @return Computed values, points, steps and failures.
     */
    public ManualResult execute(List<ManualFunction> functions, boolean recordSteps) {
        PointCollector points = new PointCollector();
        StepCollector steps = new StepCollector(recordSteps);
        Context context = new Context(view, points, steps);

        Map<Integer, Exception> failures = new LinkedHashMap<>();
        for (int i = 0; i < functions.size(); i++) {
            try {
                functions.get(i).apply(context);
            } catch (Exception e) {
                failures.put(i, e);
                errors.log("Manual function #" + i + " failed", e);
            }
        }

        Map<String, Value> values = new LinkedHashMap<>();
        for (String id : registry.idsWithRole(Role.COMPUTED)) {
            Value value = registry.find(id).map(Variable::value).orElse(null);
            if (value != null)
                values.put(id, value);
        }
        return new ManualResult(values, points.snapshot(), steps.steps(), failures);
    }

    private static final class Context implements ManualContext {
        private final VariableAccessor vars;
        private final PointCollector points;
        private final StepCollector steps;

        Context(VariableAccessor vars, PointCollector points, StepCollector steps) {
            this.vars = vars;
            this.points = points;
            this.steps = steps;
        }

        @Override
        public VariableAccessor vars() {
            return vars;
        }

        @Override
        public void collect(String graphId, Map<String, Double> coordinates) {
            points.collect(graphId, coordinates);
        }

        @Override
        public void step(String description, Map<String, Value> values) {
            steps.record(description, values);
        }

        @Override
        public void stepViews(String id, Map<String, StepView> views) {
            steps.recordViews(id, views);
        }
    }
}
