package com.formulize.compute.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link GenerationClient} posting the request as JSON over HTTP.
 */
public final class HttpGenerationClient implements GenerationClient {
    private static final Logger log = LogManager.getLogger(HttpGenerationClient.class);

    private final GenerationClientConfig config;
    private final HttpClient http;
    private final ObjectMapper mapper;

    public HttpGenerationClient(GenerationClientConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.getRequestTimeout()).build(), new ObjectMapper());
    }

    public HttpGenerationClient(GenerationClientConfig config, HttpClient http, ObjectMapper mapper) {
        if (config.getEndpoint() == null)
            throw new IllegalArgumentException("Generation endpoint is not configured");
        this.config = config;
        this.http = http;
        this.mapper = mapper;
    }

    @Override
    public CompletableFuture<GenerationResponse> generate(GenerationRequest request) {
        if (request.getModel() == null)
            request.setModel(config.getModel());
        if (request.getTemperature() == null)
            request.setTemperature(config.getTemperature());

        String body;
        try {
            body = mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new GenerationTransportException("Cannot encode request", e));
        }

        HttpRequest httpRequest = HttpRequest.newBuilder(config.getEndpoint())
                .timeout(config.getRequestTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        log.debug("POST {} for targets {}", config.getEndpoint(), request.getTargetVariableNames());

        return http.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null)
                        throw new CompletionException(
                                new GenerationTransportException("Generation request failed: " + error.getMessage(), error));
                    return decode(response);
                });
    }

    private GenerationResponse decode(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300)
            throw new GenerationTransportException("Generation service answered HTTP " + status, status);
        try {
            return mapper.readValue(response.body(), GenerationResponse.class);
        } catch (JsonProcessingException e) {
            throw new GenerationTransportException("Malformed generation response", e);
        }
    }
}
