package com.formulize.compute.io;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.formulize.compute.api.Strategy;
import com.formulize.compute.registry.VariableDefinition;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * POJO representation of an environment: the computation, the variables and
 * the formulas they appear in.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EnvironmentDefinition {
    private ComputationDef computation = new ComputationDef();
    private Map<String, VariableDefinition> variables = new LinkedHashMap<>();
    private List<FormulaDef> formulas = new ArrayList<>();

    /** Strategy, sampling mode and equations. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ComputationDef {
        private Strategy engine = Strategy.SYMBOLIC;
        private String mode = "normal";
        private List<String> expressions = new ArrayList<>();

        @JsonIgnore
        public boolean isStepMode() {
            return "step".equalsIgnoreCase(mode);
        }
    }

    /** A displayed formula. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class FormulaDef {
        private String id;
        private String expression;
        private String latex;
    }
}
