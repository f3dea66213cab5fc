package com.formulize.compute.engine;

import com.formulize.compute.api.ManualFunction;
import com.formulize.compute.api.Role;
import com.formulize.compute.api.Strategy;
import com.formulize.compute.api.Value;
import com.formulize.compute.registry.VariableDefinition;
import com.formulize.compute.registry.VariableRegistry;

import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class StepControllerTest {

    private VariableRegistry registry;
    private ComputationDispatcher dispatcher;
    private StepController controller;

    private final ManualFunction runningSum = ctx -> {
        double total = 0;
        for (Object element : ctx.vars().get("xs").elements()) {
            double x = (Double) element;
            total += x;
            ctx.step("add " + x, Map.of("x", Value.of(x), "total", Value.of(total)));
        }
        ctx.vars().set("total", total);
    };

    @Before
    public void setUp() {
        registry = new VariableRegistry();
        registry.setStepMode(true);
        registry.addVariable("xs", VariableDefinition.builder().role(Role.INPUT)
                .value(Value.ofSet(List.of(1, 2, 3))).build());
        registry.addVariable("x", VariableDefinition.builder().role(Role.INPUT).memberOf("xs").build());
        registry.addVariable("total", VariableDefinition.builder().role(Role.COMPUTED).build());
        registry.resolveMemberOfRelationships();

        dispatcher = new ComputationDispatcher(registry);
        dispatcher.setStrategy(Strategy.MANUAL);
        controller = new StepController(registry, dispatcher);
    }

    private double value(String id) {
        return registry.require(id).doubleValue();
    }

    @Test
    public void testSampleStagesFirstStep() {
        dispatcher.setComputation(null, List.of(runningSum));
        assertEquals(0, dispatcher.epoch());
        // no default in step mode
        assertNull(registry.require("x").value());

        assertEquals(3, controller.sample().size());
        assertNull(controller.stepError());
        assertEquals(0, controller.cursor());
        assertEquals(1.0, value("x"), 0.0);
        assertEquals(1.0, value("total"), 0.0);
        assertEquals(Integer.valueOf(0), registry.activeIndex("x").orElse(null));
        assertEquals("add 1.0", controller.currentStep().description());
    }

    @Test
    public void testNavigation() {
        dispatcher.setComputation(null, List.of(runningSum));
        controller.sample();

        assertFalse(controller.hasPrevious());
        assertTrue(controller.next());
        assertEquals(2.0, value("x"), 0.0);
        assertEquals(3.0, value("total"), 0.0);
        assertEquals(Set.of(0, 1), registry.processedIndices("x"));

        assertTrue(controller.goToEnd());
        assertEquals(6.0, value("total"), 0.0);
        assertFalse(controller.hasNext());
        assertFalse(controller.next());

        assertTrue(controller.previous());
        assertEquals(1, controller.cursor());
        assertTrue(controller.goToStart());
        assertEquals(1.0, value("total"), 0.0);
        assertFalse(controller.goTo(7));
        assertEquals(0, controller.cursor());
        // stepping never recomputes
        assertEquals(0, dispatcher.epoch());
    }

    @Test
    public void testActiveVariables() {
        dispatcher.setComputation(null, List.of(runningSum));
        controller.sample();
        Map<String, Set<String>> active = controller.activeVariables();
        assertEquals(Set.of("x", "total"), active.get(""));
    }

    @Test
    public void testFailureKeepsRecordedSteps() {
        ManualFunction failing = ctx -> {
            ctx.step("before", Map.of("total", Value.of(42)));
            throw new ArithmeticException("diverged");
        };
        dispatcher.setComputation(null, List.of(failing));
        assertEquals(1, controller.sample().size());
        assertEquals("diverged", controller.stepError());
        assertEquals(42.0, value("total"), 0.0);
    }

    @Test
    public void testSampleWithoutFunctions() {
        assertTrue(controller.sample().isEmpty());
        assertEquals("No manual functions to sample", controller.stepError());
        assertNull(controller.currentStep());
        assertFalse(controller.next());
    }

    @Test
    public void testClearSteps() {
        dispatcher.setComputation(null, List.of(runningSum));
        controller.sample();
        controller.next();
        controller.clearSteps();
        assertTrue(controller.steps().isEmpty());
        assertEquals(-1, controller.cursor());
        assertFalse(registry.activeIndex("x").isPresent());
        assertTrue(registry.processedIndices("x").isEmpty());
    }
}
