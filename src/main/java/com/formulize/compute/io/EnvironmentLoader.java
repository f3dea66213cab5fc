package com.formulize.compute.io;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formulize.compute.engine.ConfigurationException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Reads {@link EnvironmentDefinition}s from JSON.
 */
public final class EnvironmentLoader {
    private static final Logger log = LogManager.getLogger(EnvironmentLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_COMMENTS, true);

    private EnvironmentLoader() {
    }

    /**
     * @throws ConfigurationException if the text is not a valid environment.
     */
    public static EnvironmentDefinition parse(String json) {
        try {
            return normalize(MAPPER.readValue(json, EnvironmentDefinition.class));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid environment: " + e.getOriginalMessage(), e);
        }
    }

    public static EnvironmentDefinition load(Path path) throws IOException {
        log.info("Loading environment from {}", path);
        return parse(Files.readString(path));
    }

    /** Loads an environment from the classpath. */
    public static EnvironmentDefinition loadResource(String name) throws IOException {
        try (InputStream in = EnvironmentLoader.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null)
                throw new IOException("Resource not found: " + name);
            try {
                return normalize(MAPPER.readValue(in, EnvironmentDefinition.class));
            } catch (JsonProcessingException e) {
                throw new ConfigurationException("Invalid environment " + name + ": " + e.getOriginalMessage(), e);
            }
        }
    }

    public static String toJson(EnvironmentDefinition definition) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Cannot serialize environment: " + e.getOriginalMessage(), e);
        }
    }

    // JSON nulls replace the field defaults
    private static EnvironmentDefinition normalize(EnvironmentDefinition def) {
        if (def.getComputation() == null)
            def.setComputation(new EnvironmentDefinition.ComputationDef());
        if (def.getComputation().getExpressions() == null)
            def.getComputation().setExpressions(new ArrayList<>());
        if (def.getVariables() == null)
            def.setVariables(new LinkedHashMap<>());
        if (def.getFormulas() == null)
            def.setFormulas(new ArrayList<>());
        return def;
    }
}
