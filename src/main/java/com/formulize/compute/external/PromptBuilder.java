package com.formulize.compute.external;

import java.util.List;

/**
 * Builds the instruction texts sent along with a generation request.
 */
public final class PromptBuilder {
    public static final String SYSTEM_INSTRUCTION = "You are a precise code generator that creates JavaScript "
            + "functions to evaluate mathematical formulas. Return ONLY the function code without any "
            + "explanation or markdown. The function must be named 'evaluate', take a single object "
            + "parameter and return an object of computed values.";

    private PromptBuilder() {
    }

    public static String prompt(String formula, List<String> inputs, List<String> targets) {
        return "Create a JavaScript function that evaluates this formula: " + formula + "\n"
                + "Input variables: " + String.join(", ", inputs) + "\n"
                + "Dependent variables to calculate: " + String.join(", ", targets) + "\n"
                + "\n"
                + "Requirements:\n"
                + "1. Function must be named 'evaluate'\n"
                + "2. Takes a single parameter 'variables' containing input variable values as numbers\n"
                + "3. Must use ONLY the specified input variables\n"
                + "4. Returns object with computed values for dependent variables\n"
                + "5. Must handle division by zero and invalid operations\n"
                + "6. Use only arithmetic, comparisons, conditionals and Math functions\n"
                + "7. Return ONLY the function code\n"
                + "\n"
                + "Example structure (NOT the formula to implement):\n"
                + "function evaluate(variables) {\n"
                + "  try {\n"
                + "    return {\n"
                + "      output: someCalculation\n"
                + "    };\n"
                + "  } catch (error) {\n"
                + "    return {\n"
                + "      output: NaN\n"
                + "    };\n"
                + "  }\n"
                + "}";
    }

    public static GenerationRequest request(String formula, List<String> inputs, List<String> targets) {
        return GenerationRequest.builder()
                .formulaText(formula)
                .inputVariableNames(List.copyOf(inputs))
                .targetVariableNames(List.copyOf(targets))
                .systemInstruction(SYSTEM_INSTRUCTION)
                .prompt(prompt(formula, inputs, targets))
                .build();
    }
}
