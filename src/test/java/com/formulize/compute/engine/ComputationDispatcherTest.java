package com.formulize.compute.engine;

import com.formulize.compute.api.ComputationListener;
import com.formulize.compute.api.ManualFunction;
import com.formulize.compute.api.Role;
import com.formulize.compute.api.Strategy;
import com.formulize.compute.api.Value;
import com.formulize.compute.external.ExternalFunctionAdapter;
import com.formulize.compute.external.GenerationClient;
import com.formulize.compute.external.GenerationResponse;
import com.formulize.compute.external.GenerationTransportException;
import com.formulize.compute.registry.VariableDefinition;
import com.formulize.compute.registry.VariableRegistry;
import com.formulize.compute.symbolic.ExpressionResolver;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.Assert.*;

public class ComputationDispatcherTest {

    private VariableRegistry registry;
    private ComputationDispatcher dispatcher;
    private List<String> events;

    @Before
    public void setUp() {
        registry = new VariableRegistry();
        registry.addVariable("x", VariableDefinition.builder().role(Role.INPUT).value(Value.of(2)).build());
        registry.addVariable("y", VariableDefinition.builder().role(Role.COMPUTED).build());
        dispatcher = attach(new ComputationDispatcher(registry));
    }

    private ComputationDispatcher attach(ComputationDispatcher d) {
        events = new ArrayList<>();
        d.addListener(new ComputationListener() {
            @Override
            public void onRecomputeStart(long epoch) {
                events.add("start:" + epoch);
            }

            @Override
            public void onVariableComputed(long epoch, String variableId, Value value, boolean changed) {
                events.add(variableId + "=" + value + (changed ? "" : " (unchanged)"));
            }

            @Override
            public void onVariableError(long epoch, String variableId, Throwable error) {
                events.add("error:" + variableId + ":" + error.getMessage());
            }

            @Override
            public void onRecomputeEnd(long epoch, int variablesUpdated) {
                events.add("end:" + epoch + ":" + variablesUpdated);
            }
        });
        return d;
    }

    private static GenerationResponse code(String body) {
        return new GenerationResponse("function evaluate(v) { " + body + " }");
    }

    private double y() {
        return registry.require("y").doubleValue();
    }

    @Test
    public void testSymbolicRecompute() {
        dispatcher.setComputation(List.of("{y} = {x} + 1"), null);
        assertEquals(3.0, y(), 0.0);
        assertEquals(List.of("start:1", "y=3.0", "end:1:1"), events);
        assertTrue(dispatcher.evaluator() instanceof ExpressionResolver);
        assertNotNull(dispatcher.displayCode());

        events.clear();
        registry.setValue("x", 5);
        assertEquals(6.0, y(), 0.0);
        assertEquals(2, dispatcher.epoch());
        assertEquals(1, dispatcher.lastUpdatedCount());
    }

    @Test
    public void testUnchangedResultIsFlagged() {
        dispatcher.setComputation(List.of("{y} = {x} + 1"), null);
        events.clear();
        dispatcher.recompute();
        assertEquals(List.of("start:2", "y=3.0 (unchanged)", "end:2:1"), events);
    }

    @Test
    public void testNaNKeepsPreviousValueAndMarksErrored() {
        dispatcher.setComputation(List.of("{y} = sqrt({x})"), null);
        double before = y();
        events.clear();

        registry.setValue("x", -1);
        assertEquals(before, y(), 0.0);
        assertTrue(registry.require("y").errored());
        assertEquals(List.of("start:2", "error:y:Variable evaluated to NaN", "end:2:0"), events);

        registry.setValue("x", 9);
        assertEquals(3.0, y(), 0.0);
        assertFalse(registry.require("y").errored());
    }

    @Test
    public void testConfigurationErrors() {
        VariableRegistry bare = new VariableRegistry();
        bare.addVariable("x", VariableDefinition.builder().role(Role.INPUT).build());
        try {
            new ComputationDispatcher(bare).setComputation(List.of("{x} = 1"), null);
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertEquals("No computed variables defined", e.getMessage());
        }

        try {
            dispatcher.setComputation(List.of(), null);
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("requires at least one expression"));
        }

        dispatcher.setStrategy(Strategy.MANUAL);
        try {
            dispatcher.setComputation(List.of("{y} = {x}"), List.of());
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertEquals("Manual strategy requires at least one manual function", e.getMessage());
        }

        dispatcher.setStrategy(Strategy.EXTERNAL);
        try {
            dispatcher.setComputation(List.of("{y} = {x}"), null);
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().startsWith("No generation client"));
        }
        assertNull(dispatcher.evaluator());
    }

    @Test
    public void testFailedSwitchKeepsStrategy() {
        dispatcher.setComputation(List.of("{y} = {x} + 1"), null);
        try {
            dispatcher.setStrategy(Strategy.MANUAL);
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertEquals(Strategy.SYMBOLIC, dispatcher.strategy());
        }
    }

    @Test
    public void testManualStrategy() {
        dispatcher.setStrategy(Strategy.MANUAL);
        ManualFunction fn = ctx -> {
            double x = ctx.vars().getDouble("x");
            ctx.vars().set("y", x * x);
            ctx.collect("parabola", Map.of("x", x, "y", x * x));
        };
        dispatcher.setComputation(null, List.of(fn));
        assertEquals(4.0, y(), 0.0);
        assertEquals(1, dispatcher.lastPoints().get("parabola").size());

        registry.setValue("x", 3);
        assertEquals(9.0, y(), 0.0);
    }

    @Test
    public void testWritesDuringRecomputeDoNotCascade() {
        dispatcher.setStrategy(Strategy.MANUAL);
        ManualFunction fn = ctx -> {
            registry.setValue("x", ctx.vars().getDouble("x") + 1);
            ctx.vars().set("y", ctx.vars().getDouble("x") * 10);
        };
        dispatcher.setComputation(null, List.of(fn));
        assertEquals(1, dispatcher.epoch());
        assertEquals(30.0, y(), 0.0);
    }

    @Test
    public void testMappingOverridesEquation() {
        dispatcher.setComputation(List.of("{y} = {x} + 1"), null);
        dispatcher.setMapping("y", scope -> Value.of(scope.get("x").doubleValue() * 100));
        assertEquals(200.0, y(), 0.0);

        dispatcher.removeMapping("y");
        assertEquals(3.0, y(), 0.0);
    }

    @Test
    public void testRoleChangeRebuildsEvaluator() {
        registry.addVariable("z", VariableDefinition.builder().role(Role.INPUT).value(Value.of(0)).build());
        dispatcher.setComputation(List.of("{y} = {x} + 1", "{z} = {y} * 3"), null);
        assertEquals(0.0, registry.require("z").doubleValue(), 0.0);

        registry.setRole("z", Role.COMPUTED);
        assertEquals(9.0, registry.require("z").doubleValue(), 0.0);

        registry.setRole("z", Role.INPUT);
        registry.setRole("y", Role.INPUT);
        assertNull(dispatcher.evaluator());
    }

    @Test
    public void testStepModeSkipsRecompute() {
        registry.setStepMode(true);
        dispatcher.setComputation(List.of("{y} = {x} + 1"), null);
        registry.setValue("x", 4);
        assertEquals(0, dispatcher.epoch());
        assertNotNull(dispatcher.evaluator());
    }

    @Test
    public void testExternalStrategy() {
        GenerationClient client = request -> CompletableFuture.completedFuture(code("return { y: v.x * 10 };"));
        ComputationDispatcher external = attach(
                new ComputationDispatcher(registry, new ExternalFunctionAdapter(client), Runnable::run));
        external.setStrategy(Strategy.EXTERNAL);
        CompletableFuture<Void> done = external.setComputation(List.of("{y} = {x} * 10"), null);
        assertTrue(done.isDone());
        assertFalse(done.isCompletedExceptionally());
        assertEquals(20.0, y(), 0.0);
        assertTrue(external.displayCode().contains("function evaluate"));
    }

    @Test
    public void testStaleGenerationIsDiscarded() {
        List<CompletableFuture<GenerationResponse>> pending = new ArrayList<>();
        GenerationClient client = request -> {
            CompletableFuture<GenerationResponse> f = new CompletableFuture<>();
            pending.add(f);
            return f;
        };
        ComputationDispatcher external = attach(
                new ComputationDispatcher(registry, new ExternalFunctionAdapter(client), Runnable::run));
        external.setStrategy(Strategy.EXTERNAL);
        external.setComputation(List.of("{y} = {x} + 1"), null);
        external.setComputation(List.of("{y} = {x} * 10"), null);
        assertEquals(2, pending.size());
        assertNull(external.evaluator());

        pending.get(1).complete(code("return { y: v.x * 10 };"));
        assertEquals(20.0, y(), 0.0);

        pending.get(0).complete(code("return { y: v.x + 1 };"));
        assertEquals(20.0, y(), 0.0);
        assertEquals(1, external.epoch());
    }

    @Test
    public void testGenerationDiscardedAfterStrategySwitch() {
        CompletableFuture<GenerationResponse> pending = new CompletableFuture<>();
        ComputationDispatcher external = attach(
                new ComputationDispatcher(registry, new ExternalFunctionAdapter(request -> pending), Runnable::run));
        external.setStrategy(Strategy.EXTERNAL);
        external.setComputation(List.of("{y} = {x} + 1"), null);

        external.setStrategy(Strategy.SYMBOLIC);
        assertEquals(3.0, y(), 0.0);

        pending.complete(code("return { y: 1000 + v.x };"));
        assertEquals(3.0, y(), 0.0);
        assertTrue(external.evaluator() instanceof ExpressionResolver);
    }

    @Test
    public void testGenerationFailureKeepsPreviousEvaluator() {
        GenerationClient client = request -> CompletableFuture
                .failedFuture(new GenerationTransportException("Generation service answered HTTP 502", 502));
        ComputationDispatcher external = attach(
                new ComputationDispatcher(registry, new ExternalFunctionAdapter(client), Runnable::run));
        external.setComputation(List.of("{y} = {x} + 1"), null);
        assertEquals(3.0, y(), 0.0);

        CompletableFuture<Void> done = external.setStrategy(Strategy.EXTERNAL);
        assertTrue(done.isCompletedExceptionally());
        assertTrue(external.evaluator() instanceof ExpressionResolver);
        assertEquals(Strategy.EXTERNAL, external.strategy());
    }

    @Test
    public void testEvaluatorExceptionMarksEveryComputedVariable() {
        GenerationClient client = request -> CompletableFuture.completedFuture(
                code("if (v.x > 100) { return { y: 1 }; } throw new Error(\"out of range\");"));
        ComputationDispatcher external = attach(
                new ComputationDispatcher(registry, new ExternalFunctionAdapter(client), Runnable::run));
        external.setStrategy(Strategy.EXTERNAL);
        external.setComputation(List.of("{y} = {x}"), null);

        assertTrue(registry.require("y").errored());
        assertEquals(List.of("start:1", "error:y:out of range", "end:1:0"), events);

        registry.setValue("x", 101);
        assertEquals(1.0, y(), 0.0);
        assertFalse(registry.require("y").errored());
    }

    @Test
    public void testReset() {
        dispatcher.setComputation(List.of("{y} = {x} + 1"), null);
        dispatcher.reset();
        assertNull(dispatcher.evaluator());
        assertTrue(dispatcher.expressions().isEmpty());
        assertEquals(0, dispatcher.recompute());
    }
}
