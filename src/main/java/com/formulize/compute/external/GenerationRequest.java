package com.formulize.compute.external;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body sent to the generation service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationRequest {
    private String formulaText;
    private List<String> inputVariableNames;
    private List<String> targetVariableNames;
    private String systemInstruction;
    private String prompt;
    private String model;
    private Double temperature;
}
