package com.formulize.compute.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class HttpGenerationClientTest {

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> body = new AtomicReference<>();
    private final AtomicReference<String> received = new AtomicReference<>();

    @Before
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/generate", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = body.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @After
    public void tearDown() {
        server.stop(0);
    }

    private HttpGenerationClient client() {
        URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/generate");
        return new HttpGenerationClient(GenerationClientConfig.builder().endpoint(endpoint).build());
    }

    @Test
    public void testPostsRequestAndDecodesResponse() throws Exception {
        body.set("{\"generatedFunctionText\": \"function evaluate(v) { return { y: 1 }; }\", \"extra\": true}");
        GenerationResponse response = client()
                .generate(PromptBuilder.request("y = 1", List.of(), List.of("y"))).get();
        assertEquals("function evaluate(v) { return { y: 1 }; }", response.getGeneratedFunctionText());

        JsonNode sent = new ObjectMapper().readTree(received.get());
        assertEquals("y = 1", sent.get("formulaText").asText());
        assertEquals("gpt-4", sent.get("model").asText());
        assertEquals(0.1, sent.get("temperature").asDouble(), 1e-12);
        assertEquals("y", sent.get("targetVariableNames").get(0).asText());
    }

    @Test
    public void testNon2xxFails() throws Exception {
        status.set(500);
        body.set("{\"error\": \"overloaded\"}");
        try {
            client().generate(PromptBuilder.request("y = 1", List.of(), List.of("y"))).get();
            fail("Expected failure");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof GenerationTransportException);
            assertEquals(500, ((GenerationTransportException) e.getCause()).statusCode());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEndpointRequired() {
        new HttpGenerationClient(GenerationClientConfig.builder().build());
    }
}
