package com.formulize.compute.api;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ValueTest {

    @Test
    public void testScalar() {
        Value v = Value.of(2.5);
        assertTrue(v.isScalar());
        assertFalse(v.isSet());
        assertEquals(2.5, v.doubleValue(), 0.0);
        assertEquals(1, v.size());
        assertTrue(v.isValid());
        assertFalse(Value.NaN.isValid());
        assertFalse(Value.of(Double.POSITIVE_INFINITY).isValid());
        assertEquals(Value.NaN, Value.of(Double.NaN));
    }

    @Test
    public void testSetElementsAreNormalized() {
        Value v = Value.ofSet(List.of(1, 2L, 3.5f, "four"));
        assertEquals(List.of(1.0, 2.0, 3.5, "four"), v.elements());
        assertFalse(v.isNumericSet());
        assertTrue(Value.ofSet(List.of(1, 2)).isNumericSet());
        assertEquals(Value.ofSet(List.of(1.0, 2.0)), Value.ofSet(List.of(1, 2)));
    }

    @Test
    public void testIndexOf() {
        Value set = Value.ofSet(List.of(10, "20", "abc"));
        assertEquals(0, set.indexOf(Value.of(10)));
        assertEquals(1, set.indexOf(Value.of(20)));
        assertEquals(-1, set.indexOf(Value.of(30)));
        assertEquals(-1, Value.of(10).indexOf(Value.of(10)));
    }

    @Test
    public void testFrom() {
        assertNull(Value.from(null));
        assertEquals(Value.of(3), Value.from(3));
        assertEquals(Value.of(1.5), Value.from("1.5"));
        assertTrue(Double.isNaN(Value.from("abc").doubleValue()));
        assertArrayEquals(new double[] { 1, 2 }, Value.from(new double[] { 1, 2 }).toDoubleArray(), 0.0);
        assertEquals(Value.ofSet(List.of("a", "b")), Value.from(new Object[] { "a", "b" }));
    }

    @Test(expected = IllegalStateException.class)
    public void testScalarAccessOnSet() {
        Value.ofSet(List.of(1)).doubleValue();
    }

    @Test(expected = IllegalStateException.class)
    public void testElementsOnScalar() {
        Value.of(1).elements();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromUnsupportedType() {
        Value.from(new Object());
    }

    @Test
    public void testLabels() {
        assertEquals(Role.COMPUTED, Role.fromLabel("dependent"));
        assertEquals(Role.CONSTANT, Role.fromLabel(null));
        assertEquals(Strategy.SYMBOLIC, Strategy.fromLabel("Symbolic-Algebra"));
        assertEquals(Strategy.EXTERNAL, Strategy.fromLabel("llm"));
        assertEquals("llm", Strategy.EXTERNAL.label());
    }

    @Test
    public void testStepViewDefaults() {
        StepView view = new StepView(null, null);
        assertEquals("", view.description());
        assertTrue(view.values().isEmpty());
        assertNull(view.expression());
    }

    @Test
    public void testNegativeZeroMatchesZero() {
        assertEquals(Value.of(0), Value.of(-0.0));
        assertEquals(Value.of(0).hashCode(), Value.of(-0.0).hashCode());
        assertEquals(0, Value.ofSet(List.of(0, 1)).indexOf(Value.of(-0.0)));
        assertEquals(0, Value.ofSet(List.of("0", "1")).indexOf(Value.of(-0.0)));
        assertEquals(Value.ofSet(List.of(0.0)), Value.ofSet(List.of(-0.0)));
        assertEquals(Value.ofSet(List.of(0.0)), Value.ofVector(new double[] { -0.0 }));
    }
}
