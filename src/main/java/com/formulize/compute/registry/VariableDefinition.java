package com.formulize.compute.registry;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.formulize.compute.api.Role;
import com.formulize.compute.api.Value;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * POJO describing a variable as authored in an environment.
 *
 * A bare number in JSON ({@code "g": 9.81}) is read as a constant with that
 * value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class VariableDefinition {
    @JsonAlias("type")
    private Role role;
    @JsonAlias("default")
    private Value value;
    private List<Object> set;
    private String key;
    private String memberOf;
    private Integer index;
    private double[] range;
    private Double step;
    private Integer precision;
    private List<String> options;
    private String description;
    private String units;

    @JsonCreator
    public static VariableDefinition constant(double value) {
        return VariableDefinition.builder().role(Role.CONSTANT).value(Value.of(value)).build();
    }
}
