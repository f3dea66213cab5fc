package com.formulize.compute.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Write ownership of a variable.
 *
 * <ul>
 * <li>{@link #CONSTANT}: fixed, never written after definition.</li>
 * <li>{@link #INPUT}: written by the user (slider, text box, set control).</li>
 * <li>{@link #COMPUTED}: written only by the active strategy during a
 * recompute pass, or staged externally in step mode.</li>
 * </ul>
 */
public enum Role {
    CONSTANT("constant"),
    INPUT("input"),
    COMPUTED("computed");

    private final String label;

    Role(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Parses a role label. Older environments call computed variables
     * "dependent" and fixed ones "fixed"; both spellings are accepted.
     */
    @JsonCreator
    public static Role fromLabel(String label) {
        if (label == null)
            return CONSTANT;
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "constant", "fixed" -> CONSTANT;
            case "input" -> INPUT;
            case "computed", "dependent" -> COMPUTED;
            default -> throw new IllegalArgumentException("Unknown variable role: " + label);
        };
    }
}
