package com.formulize.compute.external;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual checks on generated function text, run before compilation.
 *
 * <ul>
 * <li>the text must declare {@code function evaluate}</li>
 * <li>every target must appear as an object key ({@code name:},
 * {@code "name":}); a target that does not is excused when the formula's
 * single-letter left-hand variable appears as a key instead</li>
 * <li>an input never mentioned in the text only yields a warning</li>
 * </ul>
 */
public final class GeneratedCodeValidator {
    private static final Logger log = LogManager.getLogger(GeneratedCodeValidator.class);
    private static final Pattern FORMULA_HEAD = Pattern.compile("^\\s*\\{?([A-Za-z])}?\\s*=");

    private GeneratedCodeValidator() {
    }

    /**
     * @return Warnings about unused inputs, possibly empty.
     * @throws GeneratedCodeInvalidException if a required element is missing.
     */
    public static List<String> validate(String code, String formula, List<String> inputs, List<String> targets) {
        if (code == null || !code.contains("function evaluate"))
            throw new GeneratedCodeInvalidException("Generated code does not contain evaluate function");

        List<String> missing = new ArrayList<>();
        for (String target : targets) {
            if (!keyPattern(target).matcher(code).find())
                missing.add(target);
        }
        if (!missing.isEmpty()) {
            String head = formulaHead(formula);
            if (head == null || !keyPattern(head).matcher(code).find()) {
                throw new GeneratedCodeInvalidException("Generated code is missing dependent variables: "
                        + String.join(", ", missing) + (head != null ? " and " + head : ""));
            }
        }

        List<String> warnings = new ArrayList<>();
        for (String input : inputs) {
            if (!Pattern.compile("\\b" + Pattern.quote(input) + "\\b").matcher(code).find()) {
                String warning = "Generated code not using input variable: " + input;
                log.warn(warning);
                warnings.add(warning);
            }
        }
        return warnings;
    }

    /** The single-letter variable a formula starts with, as in {@code F = m * a}. */
    static String formulaHead(String formula) {
        if (formula == null)
            return null;
        Matcher m = FORMULA_HEAD.matcher(formula);
        return m.find() ? m.group(1) : null;
    }

    private static Pattern keyPattern(String name) {
        return Pattern.compile("[\"']?" + Pattern.quote(name) + "[\"']?\\s*:", Pattern.CASE_INSENSITIVE);
    }
}
