package com.formulize.compute.external;

import lombok.Builder;
import lombok.Value;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings for {@link HttpGenerationClient}.
 */
@Value
@Builder
public class GenerationClientConfig {
    URI endpoint;
    @Builder.Default
    String model = "gpt-4";
    @Builder.Default
    double temperature = 0.1;
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(60);
}
