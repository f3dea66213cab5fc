package com.formulize.compute.external;

import java.util.concurrent.CompletableFuture;

/**
 * Transport to the remote code-generation service. Implementations complete
 * the future exceptionally with {@link GenerationTransportException} on
 * transport failure or a non-2xx answer.
 */
@FunctionalInterface
public interface GenerationClient {

    CompletableFuture<GenerationResponse> generate(GenerationRequest request);
}
