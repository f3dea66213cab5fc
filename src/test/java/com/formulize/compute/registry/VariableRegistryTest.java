package com.formulize.compute.registry;

import com.formulize.compute.api.Role;
import com.formulize.compute.api.Value;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class VariableRegistryTest {

    private VariableRegistry registry;
    private List<String> changes;
    private boolean recomputing;

    @Before
    public void setUp() {
        registry = new VariableRegistry();
        changes = new ArrayList<>();
        registry.setObserver(new RegistryObserver() {
            @Override
            public void onValueChanged(String variableId) {
                changes.add(variableId);
            }

            @Override
            public void onRoleChanged(String variableId, Role role) {
                changes.add("role:" + variableId + "=" + role.label());
            }

            @Override
            public boolean isRecomputing() {
                return recomputing;
            }
        });
    }

    private static VariableDefinition input(double value) {
        return VariableDefinition.builder().role(Role.INPUT).value(Value.of(value)).build();
    }

    @Test
    public void testAddVariableIsIdempotent() {
        assertTrue(registry.addVariable("x", input(2)));
        assertFalse(registry.addVariable("x", input(5)));
        assertEquals(2.0, registry.require("x").doubleValue(), 0.0);
        assertEquals(1, registry.size());
    }

    @Test
    public void testInputDefaults() {
        registry.addVariable("x", VariableDefinition.builder().role(Role.INPUT).build());
        Variable x = registry.require("x");
        assertArrayEquals(new double[] { -10, 10 }, x.range(), 0.0);
        assertEquals(1.0, x.doubleValue(), 0.0);
    }

    @Test
    public void testSetValueNotifiesObserver() {
        registry.addVariable("x", input(1));
        assertTrue(registry.setValue("x", 4));
        assertEquals(4.0, registry.require("x").doubleValue(), 0.0);
        assertEquals(List.of("x"), changes);
    }

    @Test
    public void testSetValueOnUnknownVariableFails() {
        assertFalse(registry.setValue("nope", 1));
        assertTrue(changes.isEmpty());
    }

    @Test(expected = UnknownVariableException.class)
    public void testRequireUnknownThrows() {
        registry.require("nope");
    }

    @Test
    public void testComputedVariableRejectsUserWrites() {
        registry.addVariable("y", VariableDefinition.builder().role(Role.COMPUTED).build());
        assertFalse(registry.setValue("y", 3));
        assertNull(registry.require("y").value());

        recomputing = true;
        assertTrue(registry.setValue("y", 3));
        assertEquals(3.0, registry.require("y").doubleValue(), 0.0);
        // no nested notification while a pass is running
        assertTrue(changes.isEmpty());
    }

    @Test
    public void testBulkModeSuppressesNotifications() {
        registry.addVariable("x", input(1));
        registry.beginBulk();
        registry.setValue("x", 2);
        registry.setValue("x", 3);
        registry.endBulk();
        assertTrue(changes.isEmpty());
        assertEquals(3.0, registry.require("x").doubleValue(), 0.0);
    }

    @Test
    public void testSetRoleAppliesDefaultRangeAndNotifies() {
        registry.addVariable("c", VariableDefinition.constant(5));
        assertNull(registry.require("c").range());
        assertTrue(registry.setRole("c", Role.INPUT));
        assertArrayEquals(new double[] { -10, 10 }, registry.require("c").range(), 0.0);
        assertEquals(List.of("role:c=input"), changes);
        assertFalse(registry.setRole("missing", Role.INPUT));
    }

    @Test
    public void testKeyJoinFromKeyToDependents() {
        registry.addVariable("planet", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(1, 2, 3)).value(Value.of(1)).build());
        registry.addVariable("mass", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(10, 20, 30)).key("planet").build());
        registry.addVariable("radius", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(100, 200, 300)).key("planet").build());
        registry.resolveKeyRelationships();
        assertEquals(10.0, registry.require("mass").doubleValue(), 0.0);

        registry.setValue("planet", 3);
        assertEquals(30.0, registry.require("mass").doubleValue(), 0.0);
        assertEquals(300.0, registry.require("radius").doubleValue(), 0.0);
    }

    @Test
    public void testKeyJoinFromDependentBackToKeyAndSiblings() {
        registry.addVariable("planet", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(1, 2, 3)).value(Value.of(1)).build());
        registry.addVariable("mass", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(10, 20, 30)).key("planet").build());
        registry.addVariable("radius", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(100, 200, 300)).key("planet").build());

        registry.setValue("mass", 20);
        assertEquals(2.0, registry.require("planet").doubleValue(), 0.0);
        assertEquals(200.0, registry.require("radius").doubleValue(), 0.0);
        assertEquals(20.0, registry.require("mass").doubleValue(), 0.0);
    }

    @Test
    public void testKeyJoinIgnoresValuesOutsideTheSet() {
        registry.addVariable("planet", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(1, 2, 3)).value(Value.of(1)).build());
        registry.addVariable("mass", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(10, 20, 30)).key("planet").build());

        registry.setValue("planet", 7);
        assertEquals(10.0, registry.require("mass").doubleValue(), 0.0);
    }

    @Test
    public void testKeyResolvedWhenKeyIsAddedLater() {
        registry.addVariable("mass", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(10, 20, 30)).key("planet").build());
        registry.addVariable("planet", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(1, 2, 3)).value(Value.of(2)).build());
        assertNull(registry.require("mass").value());
        registry.resolveKeyRelationships();
        assertEquals(20.0, registry.require("mass").doubleValue(), 0.0);
    }

    @Test
    public void testMemberOfInheritsParentSet() {
        registry.addVariable("xs", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(4, 5, 6)).build());
        registry.addVariable("x", VariableDefinition.builder().role(Role.INPUT).memberOf("xs").build());
        registry.addVariable("y", VariableDefinition.builder().role(Role.INPUT).memberOf("xs").index(2).build());
        registry.resolveMemberOfRelationships();

        assertEquals(List.of(4.0, 5.0, 6.0), registry.require("x").set());
        assertEquals(4.0, registry.require("x").doubleValue(), 0.0);
        assertEquals(6.0, registry.require("y").doubleValue(), 0.0);
    }

    @Test
    public void testMemberOfLeavesValueUnsetInStepMode() {
        registry.setStepMode(true);
        registry.addVariable("xs", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(4, 5, 6)).build());
        registry.addVariable("x", VariableDefinition.builder().role(Role.INPUT).memberOf("xs").build());
        registry.resolveMemberOfRelationships();
        assertNull(registry.require("x").value());
    }

    @Test
    public void testStageValueDoesNotNotify() {
        registry.addVariable("y", VariableDefinition.builder().role(Role.COMPUTED).build());
        assertTrue(registry.stageValue("y", Value.of(9)));
        assertEquals(9.0, registry.require("y").doubleValue(), 0.0);
        assertTrue(changes.isEmpty());
    }

    @Test
    public void testSnapshotsAreDetached() {
        registry.addVariable("x", input(1));
        Map<String, Variable> snapshot = registry.getVariables();
        registry.setValue("x", 8);
        assertEquals(1.0, snapshot.get("x").doubleValue(), 0.0);
        assertEquals(Value.of(8), registry.values().get("x"));
    }

    @Test
    public void testSetSetValue() {
        registry.addVariable("xs", VariableDefinition.builder().role(Role.INPUT)
                .set(Arrays.asList(1, 2)).build());
        assertTrue(registry.setSetValue("xs", Arrays.asList(3, 4, 5)));
        Value v = registry.require("xs").value();
        assertTrue(v.isSet());
        assertEquals(3, v.size());
    }

    @Test
    public void testIndexBookkeepingAndReset() {
        registry.addVariable("x", input(1));
        registry.setActiveIndex("x", 2);
        registry.addProcessedIndex("x", 0);
        registry.addProcessedIndex("x", 2);
        assertEquals(Integer.valueOf(2), registry.activeIndex("x").orElse(null));
        assertEquals(2, registry.processedIndices("x").size());

        registry.reset();
        assertEquals(0, registry.size());
        assertFalse(registry.activeIndex("x").isPresent());
        assertTrue(registry.processedIndices("x").isEmpty());
    }
}
