package com.coordinator.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Reads JSON from a running coordinator's REST API for the one-shot CLI commands.
 */
class CoordinatorClient {

    record Reply(int statusCode, JsonNode body) {}

    private final ObjectMapper objectMapper;
    private final String host;
    private final int port;

    CoordinatorClient(ObjectMapper objectMapper, String host, int port) {
        this.objectMapper = objectMapper;
        this.host = host;
        this.port = port;
    }

    Reply get(String path) throws IOException, InterruptedException {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://" + host + ":" + port + path))
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        String body = response.body();
        JsonNode json = body == null || body.isBlank() ? objectMapper.nullNode() : objectMapper.readTree(body);
        return new Reply(response.statusCode(), json);
    }

    String address() {
        return host + ":" + port;
    }
}
