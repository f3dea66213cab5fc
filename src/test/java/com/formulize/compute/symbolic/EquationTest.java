package com.formulize.compute.symbolic;

import com.formulize.compute.expr.EvalException;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class EquationTest {

    @Test
    public void testScalarForms() {
        Equation eq = Equation.parse("y = x + 1");
        assertTrue(eq.definesOnLeft("y"));
        assertFalse(eq.definesOnRight("x"));
        assertFalse(eq.isVectorForm());
        assertEquals(List.of(), eq.vectorTargets());

        Equation reversed = Equation.parse("x * 2 = z");
        assertTrue(reversed.definesOnRight("z"));
        assertFalse(reversed.definesOnLeft("z"));
    }

    @Test
    public void testVectorForm() {
        Equation eq = Equation.parse("[a, b] = [x * 2, x * 3]");
        assertTrue(eq.isVectorForm());
        assertEquals(List.of("a", "b"), eq.vectorTargets());
    }

    @Test
    public void testComparisonsAreNotAssignments() {
        Equation eq = Equation.parse("y = x >= 2 ? (x == 3) : x <= 1");
        assertTrue(eq.definesOnLeft("y"));
        Equation ne = Equation.parse("y = x != 2");
        assertTrue(ne.definesOnLeft("y"));
    }

    @Test(expected = EvalException.class)
    public void testNoAssignment() {
        Equation.parse("x + 1");
    }

    @Test(expected = EvalException.class)
    public void testTwoAssignments() {
        Equation.parse("a = b = c");
    }

    @Test(expected = EvalException.class)
    public void testEmptySide() {
        Equation.parse("y = ");
    }
}
