package com.formulize.compute.external;

import com.formulize.compute.api.Value;
import com.formulize.compute.expr.EvalException;

import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GeneratedFunctionCompilerTest {

    private static Map<String, Value> vars(Object... pairs) {
        Map<String, Value> out = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2)
            out.put((String) pairs[i], Value.of(((Number) pairs[i + 1]).doubleValue()));
        return out;
    }

    @Test
    public void testObjectReturn() {
        GeneratedFunction fn = GeneratedFunctionCompiler.compile(
                "function evaluate(variables) {\n"
                        + "  const m = variables.m;\n"
                        + "  const v = variables[\"v\"];\n"
                        + "  return { K: 0.5 * m * v ** 2 };\n"
                        + "}",
                List.of("K"));
        assertEquals("variables", fn.parameter());
        assertEquals(Value.of(9), fn.evaluate(vars("m", 2, "v", 3)).get("K"));
    }

    @Test
    public void testFencesAndProseStripped() {
        GeneratedFunction fn = GeneratedFunctionCompiler.compile(
                "Here you go:\n```javascript\nfunction evaluate(p) { return { y: p.x + 1 }; }\n```",
                List.of("y"));
        assertEquals(Value.of(3), fn.evaluate(vars("x", 2)).get("y"));
    }

    @Test
    public void testDestructuringAndMath() {
        GeneratedFunction fn = GeneratedFunctionCompiler.compile(
                "function evaluate(variables) {\n"
                        + "  'use strict';\n"
                        + "  const { G, M, r: radius } = variables;\n"
                        + "  let g = G * M / Math.pow(radius, 2);\n"
                        + "  return { g_surface: Math.round(g) };\n"
                        + "}",
                List.of("g_surface"));
        assertEquals(Value.of(2), fn.evaluate(vars("G", 1, "M", 8, "r", 2)).get("g_surface"));
    }

    @Test
    public void testResultObjectBuiltIncrementally() {
        GeneratedFunction fn = GeneratedFunctionCompiler.compile(
                "function evaluate(variables) {\n"
                        + "  const result = {};\n"
                        + "  let total = 0;\n"
                        + "  total += variables.a;\n"
                        + "  total *= 2;\n"
                        + "  result.sum = total;\n"
                        + "  result.diff = variables.a - variables.b;\n"
                        + "  return result;\n"
                        + "}",
                List.of("sum", "diff"));
        Map<String, Value> out = fn.evaluate(vars("a", 5, "b", 1));
        assertEquals(Value.of(10), out.get("sum"));
        assertEquals(Value.of(4), out.get("diff"));
    }

    @Test
    public void testBranchesAndErrorHandling() {
        GeneratedFunction fn = GeneratedFunctionCompiler.compile(
                "function evaluate(variables) {\n"
                        + "  try {\n"
                        + "    if (variables.b === 0) {\n"
                        + "      throw new Error(\"Division by zero\");\n"
                        + "    } else if (variables.b < 0) return { q: -1 };\n"
                        + "    else {\n"
                        + "      return { q: variables.a / variables.b };\n"
                        + "    }\n"
                        + "  } catch (error) {\n"
                        + "    return { q: NaN };\n"
                        + "  }\n"
                        + "}",
                List.of("q"));
        assertEquals(Value.of(2), fn.evaluate(vars("a", 6, "b", 3)).get("q"));
        assertEquals(Value.of(-1), fn.evaluate(vars("a", 6, "b", -3)).get("q"));
        assertEquals(Value.NaN, fn.evaluate(vars("a", 6, "b", 0)).get("q"));
    }

    @Test
    public void testBareReturnForSingleTarget() {
        GeneratedFunction fn = GeneratedFunctionCompiler.compile(
                "function evaluate(v) { return v.x * v.x; }", List.of("sq"));
        assertEquals(Value.of(16), fn.evaluate(vars("x", 4)).get("sq"));
    }

    @Test(expected = EvalException.class)
    public void testUncaughtThrowFailsEvaluation() {
        GeneratedFunction fn = GeneratedFunctionCompiler.compile(
                "function evaluate(v) { throw new Error(\"nope\"); }", List.of("y"));
        fn.evaluate(vars());
    }

    @Test(expected = GeneratedCodeInvalidException.class)
    public void testLoopsRejected() {
        GeneratedFunctionCompiler.compile(
                "function evaluate(v) { for (let i = 0; i < 3; i++) {} return { y: 1 }; }", List.of("y"));
    }

    @Test(expected = GeneratedCodeInvalidException.class)
    public void testHostAccessRejected() {
        GeneratedFunctionCompiler.compile(
                "function evaluate(v) { return { y: require(\"fs\") }; }", List.of("y"));
    }

    @Test(expected = GeneratedCodeInvalidException.class)
    public void testMissingFunction() {
        GeneratedFunctionCompiler.compile("const y = 1;", List.of("y"));
    }
}
