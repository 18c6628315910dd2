package com.zzf.workbridge.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

@Slf4j
public final class HttpAgentSessionClient implements AgentSessionClient {
    private static final long DEFAULT_TIMEOUT_MS = 3_000L;

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public HttpAgentSessionClient(ObjectMapper mapper) {
        this(mapper, DEFAULT_TIMEOUT_MS);
    }

    public HttpAgentSessionClient(ObjectMapper mapper, long timeoutMs) {
        this.mapper = mapper;
        this.timeout = Duration.ofMillis(timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS);
        this.http = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .build();
    }

    @Override
    public CompletableFuture<JsonNode> listSessions(int port) {
        return get(port, "/session");
    }

    @Override
    public CompletableFuture<JsonNode> listMessages(int port, String sessionId) {
        String id = URLEncoder.encode(sessionId, StandardCharsets.UTF_8);
        return get(port, "/session/" + id + "/message");
    }

    private CompletableFuture<JsonNode> get(int port, String path) {
        if (port <= 0 || port > 65535) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Invalid agent port: " + port));
        }
        URI uri = URI.create("http://127.0.0.1:" + port + path);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        log.debug("agent.query uri={}", uri);
        return http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(response -> {
                    int status = response.statusCode();
                    String body = response.body() == null ? "" : response.body();
                    if (status < 200 || status >= 300) {
                        throw new IllegalStateException("Agent server HTTP " + status + " for " + path + ": " + trim(body, 300));
                    }
                    if (body.isBlank()) {
                        return mapper.createArrayNode();
                    }
                    try {
                        return mapper.readTree(body);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Invalid JSON from agent server for " + path, e);
                    }
                });
    }

    private static String trim(String value, int limit) {
        if (value.length() <= limit) {
            return value;
        }
        return value.substring(0, Math.max(0, limit - 3)) + "...";
    }
}
