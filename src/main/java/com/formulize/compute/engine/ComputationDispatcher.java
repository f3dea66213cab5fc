package com.formulize.compute.engine;

import com.formulize.compute.api.ComputationException;
import com.formulize.compute.api.ComputationListener;
import com.formulize.compute.api.Evaluator;
import com.formulize.compute.api.ManualFunction;
import com.formulize.compute.api.Role;
import com.formulize.compute.api.Strategy;
import com.formulize.compute.api.Value;
import com.formulize.compute.api.VariableMapping;
import com.formulize.compute.external.ExternalFunctionAdapter;
import com.formulize.compute.external.GeneratedFunction;
import com.formulize.compute.manual.ManualEvaluator;
import com.formulize.compute.manual.ManualSandbox;
import com.formulize.compute.registry.RegistryObserver;
import com.formulize.compute.registry.Variable;
import com.formulize.compute.registry.VariableRegistry;
import com.formulize.compute.symbolic.ExpressionResolver;
import com.formulize.compute.util.CompositeComputationListener;
import com.formulize.compute.util.ComputationExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the active strategy and the recompute trigger.
 *
 * <h2>Evaluator lifecycle</h2>
 * Exactly one evaluator is active at a time. It is rebuilt from the stored
 * expressions, manual functions and mappings whenever the computation, the
 * strategy or a variable's role changes. The external strategy builds its
 * evaluator asynchronously: the previous one keeps serving recomputes until
 * the generated function is validated and installed.
 *
 * <h2>Recompute</h2>
 * {@link #recompute()} snapshots every value, invokes the evaluator and
 * accepts a result for a computed variable only if it is a finite number or a
 * valid set. Other variables keep their value and are flagged errored. A
 * recompute requested while one is running is ignored, so writes made by a
 * strategy during its own pass never cascade.
 */
public final class ComputationDispatcher implements RegistryObserver {
    private static final Logger log = LogManager.getLogger(ComputationDispatcher.class);

    private final VariableRegistry registry;
    private final ManualSandbox sandbox;
    private final ExternalFunctionAdapter adapter;
    private final Executor completionExecutor;
    private final CompositeComputationListener listeners = new CompositeComputationListener();

    private Strategy strategy = Strategy.SYMBOLIC;
    private volatile Evaluator evaluator;
    private volatile boolean recomputing;
    private long epoch;
    private int lastUpdated;

    private List<String> expressions = List.of();
    private List<ManualFunction> manualFunctions = List.of();
    private final Map<String, VariableMapping> mappings = new LinkedHashMap<>();

    private String displayCode;
    private Map<String, List<Map<String, Double>>> lastPoints = Map.of();

    private final AtomicLong generationTickets = new AtomicLong();
    private long installedTicket;

    /**
     * Dispatcher without the external strategy, completing everything on the
     * calling thread.
     */
    public ComputationDispatcher(VariableRegistry registry) {
        this(registry, null, Runnable::run);
    }

    /**
     * @param registry           The registry to observe.
     * @param adapter            Generation adapter for the external strategy,
     *                           may be null.
     * @param completionExecutor Where generated evaluators are installed; pass
     *                           the engine thread's executor when generation
     *                           completes on a foreign thread.
     */
    public ComputationDispatcher(VariableRegistry registry, ExternalFunctionAdapter adapter,
            Executor completionExecutor) {
        this.registry = registry;
        this.sandbox = new ManualSandbox(registry);
        this.adapter = adapter;
        this.completionExecutor = completionExecutor;
        registry.setObserver(this);
    }

    public void addListener(ComputationListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(ComputationListener listener) {
        return listeners.remove(listener);
    }

    // ── Configuration ────────────────────────────────────────────

    /**
     * Installs a new computation and runs the initial pass (skipped in step
     * mode).
     *
     * @param expressions     Equations, used by the symbolic and external
     *                        strategies.
     * @param manualFunctions Functions, used by the manual strategy.
     * @return Completes when the evaluator is installed. Only the external
     *         strategy completes later.
     * @throws ConfigurationException if there are no computed variables, or
     *                                nothing to build the active strategy's
     *                                evaluator from.
     */
    public synchronized CompletableFuture<Void> setComputation(List<String> expressions,
            List<ManualFunction> manualFunctions) {
        List<String> exprs = expressions != null ? List.copyOf(expressions) : List.of();
        List<ManualFunction> fns = manualFunctions != null ? List.copyOf(manualFunctions) : List.of();
        validate(strategy, exprs, fns);
        this.expressions = exprs;
        this.manualFunctions = fns;
        return rebuild();
    }

    /**
     * Switches strategy, rebuilds the evaluator and recomputes.
     *
     * @throws ConfigurationException if the new strategy has nothing to build
     *                                from; the strategy is not changed.
     */
    public synchronized CompletableFuture<Void> setStrategy(Strategy strategy) {
        if (strategy == this.strategy)
            return CompletableFuture.completedFuture(null);
        if (isConfigured())
            validate(strategy, expressions, manualFunctions);
        log.info("Strategy {} -> {}", this.strategy.label(), strategy.label());
        this.strategy = strategy;
        return isConfigured() ? rebuild() : CompletableFuture.completedFuture(null);
    }

    /**
     * Registers an explicit mapping for a computed variable. It overrides any
     * equation defining the same variable.
     */
    public synchronized void setMapping(String variableId, VariableMapping mapping) {
        mappings.put(variableId, mapping);
        if (strategy == Strategy.SYMBOLIC && isConfigured())
            rebuild();
    }

    public synchronized void removeMapping(String variableId) {
        if (mappings.remove(variableId) != null && strategy == Strategy.SYMBOLIC && isConfigured())
            rebuild();
    }

    private boolean isConfigured() {
        return !expressions.isEmpty() || !manualFunctions.isEmpty();
    }

    private void validate(Strategy strategy, List<String> exprs, List<ManualFunction> fns) {
        if (registry.idsWithRole(Role.COMPUTED).isEmpty())
            throw new ConfigurationException("No computed variables defined");
        if (strategy == Strategy.MANUAL && fns.isEmpty())
            throw new ConfigurationException("Manual strategy requires at least one manual function");
        if (strategy != Strategy.MANUAL && exprs.isEmpty())
            throw new ConfigurationException("Strategy " + strategy.label() + " requires at least one expression");
        if (strategy == Strategy.EXTERNAL && adapter == null)
            throw new ConfigurationException("No generation client configured for the external strategy");
    }

    private CompletableFuture<Void> rebuild() {
        List<String> computed = registry.idsWithRole(Role.COMPUTED);
        switch (strategy) {
            case SYMBOLIC: {
                ExpressionResolver resolver = new ExpressionResolver(expressions, computed, registry.ids(), mappings);
                install(resolver, ComputationExplain.describe(resolver));
                return CompletableFuture.completedFuture(null);
            }
            case MANUAL: {
                install(new ManualEvaluator(sandbox, manualFunctions),
                        ComputationExplain.describeManual(manualFunctions.size(), computed));
                return CompletableFuture.completedFuture(null);
            }
            case EXTERNAL:
            default:
                return generate(computed);
        }
    }

    private CompletableFuture<Void> generate(List<String> computed) {
        long ticket = generationTickets.incrementAndGet();
        List<String> inputs = registry.idsWithRole(Role.INPUT);
        List<String> exprs = expressions;
        return adapter.generate(String.join("\n", exprs), inputs, computed)
                .thenAcceptAsync(fn -> installGenerated(ticket, fn, exprs), completionExecutor)
                .whenComplete((ignored, error) -> {
                    if (error != null)
                        log.warn("Generation #{} failed, keeping previous evaluator: {}", ticket, error.getMessage());
                });
    }

    private synchronized void installGenerated(long ticket, GeneratedFunction fn, List<String> exprs) {
        if (strategy != Strategy.EXTERNAL) {
            log.warn("Discarding generation #{}: strategy changed to {}", ticket, strategy.label());
            return;
        }
        if (ticket < installedTicket) {
            log.warn("Discarding generation #{}: #{} is already installed", ticket, installedTicket);
            return;
        }
        installedTicket = ticket;
        install(fn, ComputationExplain.describeGenerated(fn, exprs));
    }

    private void install(Evaluator next, String code) {
        this.evaluator = next;
        this.displayCode = code;
        if (registry.isStepMode()) {
            log.debug("Step mode: initial pass skipped");
            return;
        }
        recompute();
    }

    // ── Recompute ────────────────────────────────────────────────

    /**
     * Runs one pass of the active evaluator.
     *
     * @return Number of computed variables that accepted a result; 0 if there
     *         is no evaluator or a pass is already running.
     */
    public synchronized int recompute() {
        if (recomputing)
            return 0;
        Evaluator active = evaluator;
        if (active == null)
            return 0;

        recomputing = true;
        epoch++;
        int updated = 0;
        listeners.onRecomputeStart(epoch);
        try {
            Map<String, Value> results;
            try {
                results = active.evaluate(registry.values());
            } catch (RuntimeException e) {
                log.warn("Evaluator failed in pass {}: {}", epoch, e.getMessage());
                for (String id : registry.idsWithRole(Role.COMPUTED)) {
                    registry.markErrored(id, true);
                    listeners.onVariableError(epoch, id, e);
                }
                return 0;
            }

            for (String id : registry.idsWithRole(Role.COMPUTED)) {
                Value value = results != null ? results.get(id) : null;
                if (value != null && value.isValid()) {
                    Value previous = registry.find(id).map(Variable::value).orElse(null);
                    registry.write(id, value);
                    registry.markErrored(id, false);
                    updated++;
                    listeners.onVariableComputed(epoch, id, value, !value.equals(previous));
                } else {
                    registry.markErrored(id, true);
                    listeners.onVariableError(epoch, id, new ComputationException(
                            value == null ? "Variable was not computed" : "Variable evaluated to NaN"));
                }
            }
            if (active instanceof ManualEvaluator manual && manual.lastResult() != null)
                lastPoints = manual.lastResult().points();
            return updated;
        } finally {
            recomputing = false;
            lastUpdated = updated;
            listeners.onRecomputeEnd(epoch, updated);
        }
    }

    // ── RegistryObserver ─────────────────────────────────────────

    @Override
    public void onValueChanged(String variableId) {
        if (registry.isStepMode())
            return;
        recompute();
    }

    @Override
    public synchronized void onRoleChanged(String variableId, Role role) {
        if (registry.idsWithRole(Role.COMPUTED).isEmpty()) {
            evaluator = null;
            displayCode = null;
            return;
        }
        if (!isConfigured())
            return;
        try {
            validate(strategy, expressions, manualFunctions);
            rebuild();
        } catch (ConfigurationException e) {
            log.warn("Role of {} changed to {}, evaluator not rebuilt: {}", variableId, role.label(), e.getMessage());
        }
    }

    @Override
    public boolean isRecomputing() {
        return recomputing;
    }

    // ── State ────────────────────────────────────────────────────

    /** Drops the evaluator, expressions, functions, mappings and points. */
    public synchronized void reset() {
        evaluator = null;
        displayCode = null;
        expressions = List.of();
        manualFunctions = List.of();
        mappings.clear();
        lastPoints = Map.of();
    }

    public Strategy strategy() {
        return strategy;
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    public long epoch() {
        return epoch;
    }

    public int lastUpdatedCount() {
        return lastUpdated;
    }

    public List<String> expressions() {
        return expressions;
    }

    public List<ManualFunction> manualFunctions() {
        return manualFunctions;
    }

    public Map<String, VariableMapping> mappings() {
        return Collections.unmodifiableMap(mappings);
    }

    /** Human-readable form of the active evaluator, or null if none. */
    public String displayCode() {
        return displayCode;
    }

    /** Points collected by manual functions in the last pass. */
    public Map<String, List<Map<String, Double>>> lastPoints() {
        return lastPoints;
    }

    public ManualSandbox sandbox() {
        return sandbox;
    }

    public VariableRegistry registry() {
        return registry;
    }
}
