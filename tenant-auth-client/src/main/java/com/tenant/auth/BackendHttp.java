package com.tenant.auth;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenant.auth.server.exception.AuthServiceException;
import com.tenant.auth.server.exception.UpstreamUnavailableException;

/**
 * One request/response exchange with the backend. Timeouts and I/O failures become
 * {@link UpstreamUnavailableException}, non-2xx answers {@link AuthServiceException} with the status.
 */
final class BackendHttp {

    static final ObjectMapper MAPPER =
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final HttpClient http;
    private final BackendCredentials credentials;
    private final Duration requestTimeout;

    /**
     * @param credentials {@code null} for endpoints that need no credentials
     */
    BackendHttp(HttpClient http, BackendCredentials credentials, Duration requestTimeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.credentials = credentials;
        this.requestTimeout = (requestTimeout == null) ? Duration.ofSeconds(10) : requestTimeout;
    }

    HttpResponse<String> send(HttpRequest.Builder builder, String operation) {
        if (credentials != null) {
            builder.header("Authorization", "Bearer " + credentials.currentToken());
        }
        HttpRequest req = builder.timeout(requestTimeout).build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new UpstreamUnavailableException(operation + " timed out after " + requestTimeout, e);
        } catch (IOException e) {
            throw new UpstreamUnavailableException(operation + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(operation + " was interrupted", e);
        }

        int sc = resp.statusCode();
        if (sc < 200 || sc >= 300) {
            throw new AuthServiceException(sc, operation + " failed: HTTP " + sc + " - " + resp.body());
        }
        return resp;
    }

    String postJson(URI uri, Object body, String operation) {
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new AuthServiceException(operation + ": unable to encode the request", e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json));
        return send(builder, operation).body();
    }

    static JsonNode readTree(String body, String operation) {
        try {
            return MAPPER.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new AuthServiceException(operation + ": unable to parse the response: " + e.getOriginalMessage(), e);
        }
    }

    static <T> T read(String body, TypeReference<T> type, String operation) {
        try {
            return MAPPER.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new AuthServiceException(operation + ": unable to parse the response: " + e.getOriginalMessage(), e);
        }
    }
}
