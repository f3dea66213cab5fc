package com.formulize.compute;

import com.formulize.compute.api.ComputationListener;
import com.formulize.compute.api.ManualFunction;
import com.formulize.compute.api.Role;
import com.formulize.compute.api.Strategy;
import com.formulize.compute.api.Value;
import com.formulize.compute.api.VariableMapping;
import com.formulize.compute.engine.ComputationDispatcher;
import com.formulize.compute.engine.StepController;
import com.formulize.compute.external.ExternalFunctionAdapter;
import com.formulize.compute.external.GenerationClient;
import com.formulize.compute.io.EnvironmentDefinition;
import com.formulize.compute.registry.Variable;
import com.formulize.compute.registry.VariableDefinition;
import com.formulize.compute.registry.VariableRegistry;
import com.formulize.compute.wiring.ComputationPublisher;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point tying the registry, the strategy dispatcher and the step
 * controller together.
 *
 * <pre>{@code
 * Formulize f = Formulize.create();
 * f.load(EnvironmentLoader.loadResource("kinetic-energy.json"));
 * f.setValue("v", 3);
 * double k = f.value("K").doubleValue();
 * }</pre>
 *
 * Not thread-safe; use {@link #publisher(int)} to feed updates from other
 * threads.
 */
public final class Formulize {
    private static final Logger log = LogManager.getLogger(Formulize.class);

    private final VariableRegistry registry;
    private final ComputationDispatcher dispatcher;
    private final StepController steps;
    private List<EnvironmentDefinition.FormulaDef> formulas = List.of();

    private Formulize(VariableRegistry registry, ComputationDispatcher dispatcher) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.steps = new StepController(registry, dispatcher);
    }

    /** Engine with the symbolic and manual strategies. */
    public static Formulize create() {
        VariableRegistry registry = new VariableRegistry();
        return new Formulize(registry, new ComputationDispatcher(registry));
    }

    /**
     * Engine with all three strategies.
     *
     * @param client             Transport to the generation service.
     * @param completionExecutor Executor generated evaluators are installed
     *                           on.
     */
    public static Formulize create(GenerationClient client, Executor completionExecutor) {
        VariableRegistry registry = new VariableRegistry();
        ExternalFunctionAdapter adapter = new ExternalFunctionAdapter(client);
        return new Formulize(registry, new ComputationDispatcher(registry, adapter, completionExecutor));
    }

    // ── Environment ──────────────────────────────────────────────

    public CompletableFuture<Void> load(EnvironmentDefinition environment) {
        return load(environment, List.of());
    }

    /**
     * Replaces the current state with an environment and runs the initial
     * pass (skipped in step mode).
     *
     * @param manualFunctions Functions for the manual strategy.
     */
    public CompletableFuture<Void> load(EnvironmentDefinition environment, List<ManualFunction> manualFunctions) {
        reset();
        EnvironmentDefinition.ComputationDef computation = environment.getComputation();
        registry.setStepMode(computation.isStepMode());
        for (Map.Entry<String, VariableDefinition> e : environment.getVariables().entrySet())
            registry.addVariable(e.getKey(), e.getValue());
        registry.resolveKeyRelationships();
        registry.resolveMemberOfRelationships();
        formulas = List.copyOf(environment.getFormulas());

        dispatcher.setStrategy(computation.getEngine() != null ? computation.getEngine() : Strategy.SYMBOLIC);
        log.info("Loaded {} variable(s), {} formula(s), strategy {}", registry.size(), formulas.size(),
                dispatcher.strategy().label());
        if (registry.idsWithRole(Role.COMPUTED).isEmpty())
            return CompletableFuture.completedFuture(null);
        return dispatcher.setComputation(computation.getExpressions(), manualFunctions);
    }

    /** Removes every variable, the computation and recorded steps. */
    public void reset() {
        steps.clearSteps();
        dispatcher.reset();
        registry.reset();
        registry.setStepMode(false);
        formulas = List.of();
    }

    // ── Variables ────────────────────────────────────────────────

    public boolean addVariable(String id, VariableDefinition definition) {
        return registry.addVariable(id, definition);
    }

    public boolean setValue(String id, double value) {
        return registry.setValue(id, value);
    }

    public boolean setValue(String id, Value value) {
        return registry.setValue(id, value);
    }

    public boolean setSetValue(String id, List<?> elements) {
        return registry.setSetValue(id, elements);
    }

    public boolean setRole(String id, Role role) {
        return registry.setRole(id, role);
    }

    /** @return The current value, or null for unknown or unset variables. */
    public Value value(String id) {
        return registry.find(id).map(Variable::value).orElse(null);
    }

    public Map<String, Variable> getVariables() {
        return registry.getVariables();
    }

    // ── Computation ──────────────────────────────────────────────

    public CompletableFuture<Void> setComputation(List<String> expressions, List<ManualFunction> manualFunctions) {
        return dispatcher.setComputation(expressions, manualFunctions);
    }

    public CompletableFuture<Void> setStrategy(Strategy strategy) {
        return dispatcher.setStrategy(strategy);
    }

    public void setMapping(String variableId, VariableMapping mapping) {
        dispatcher.setMapping(variableId, mapping);
    }

    public int recompute() {
        return dispatcher.recompute();
    }

    public void addListener(ComputationListener listener) {
        dispatcher.addListener(listener);
    }

    public String displayCode() {
        return dispatcher.displayCode();
    }

    public Map<String, List<Map<String, Double>>> points() {
        return dispatcher.lastPoints();
    }

    public List<EnvironmentDefinition.FormulaDef> formulas() {
        return formulas;
    }

    // ── Collaborators ────────────────────────────────────────────

    public VariableRegistry registry() {
        return registry;
    }

    public ComputationDispatcher dispatcher() {
        return dispatcher;
    }

    public StepController steps() {
        return steps;
    }

    /**
     * Creates a ring buffer publisher over this engine. After
     * {@link ComputationPublisher#start()}, feed every update through it.
     */
    public ComputationPublisher publisher(int bufferSize) {
        return new ComputationPublisher(registry, dispatcher, bufferSize);
    }
}
