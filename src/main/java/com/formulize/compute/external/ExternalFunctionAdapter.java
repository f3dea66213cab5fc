package com.formulize.compute.external;

import com.formulize.compute.engine.ConfigurationException;

import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Requests an {@code evaluate} function from the generation service, validates
 * the answer and compiles it.
 *
 * The returned future fails with {@link GenerationTransportException} or
 * {@link GeneratedCodeInvalidException}; it never installs anything itself.
 */
@Log4j2
public final class ExternalFunctionAdapter {
    private final GenerationClient client;

    public ExternalFunctionAdapter(GenerationClient client) {
        this.client = client;
    }

    /**
     * @param formula Formula text, one equation per line.
     * @param inputs  Input variable ids, in order.
     * @param targets Computed variable ids, in order.
     */
    public CompletableFuture<GeneratedFunction> generate(String formula, List<String> inputs, List<String> targets) {
        if (formula == null || formula.isBlank())
            return CompletableFuture.failedFuture(
                    new ConfigurationException("Cannot generate function from empty formula"));
        if (targets.isEmpty())
            return CompletableFuture.failedFuture(
                    new ConfigurationException("Cannot generate function without computed variables"));

        log.info("Requesting evaluate function for {} (inputs {})", targets, inputs);
        GenerationRequest request = PromptBuilder.request(formula, inputs, targets);
        return client.generate(request).thenApply(response -> {
            String text = response != null ? response.getGeneratedFunctionText() : null;
            if (text == null || text.isBlank())
                throw new GeneratedCodeInvalidException("Generation service returned no function text");
            List<String> warnings = GeneratedCodeValidator.validate(text, formula, inputs, targets);
            GeneratedFunction function = GeneratedFunctionCompiler.compile(text.trim(), targets);
            log.info("Compiled generated function for {} ({} warning(s))", targets, warnings.size());
            return function;
        });
    }
}
