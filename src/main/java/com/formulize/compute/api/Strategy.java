package com.formulize.compute.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The interchangeable ways of producing computed values from the same
 * declarative description.
 */
public enum Strategy {
    /** Fixed-point resolution of equations. */
    SYMBOLIC("symbolic-algebra"),
    /** User functions that mutate variables directly. */
    MANUAL("manual"),
    /** Evaluators generated by a remote code-generation service. */
    EXTERNAL("llm");

    private final String label;

    Strategy(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Strategy fromLabel(String label) {
        if (label == null)
            return SYMBOLIC;
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "symbolic", "symbolic-algebra" -> SYMBOLIC;
            case "manual" -> MANUAL;
            case "llm", "external" -> EXTERNAL;
            default -> throw new IllegalArgumentException("Unknown computation engine: " + label);
        };
    }
}
