package com.tenant.auth;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenant.auth.server.exception.AuthServiceException;
import com.tenant.auth.server.exception.UpstreamUnavailableException;
import com.tenant.auth.server.key.SigningKey;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;

/**
 * Exchanges a self-signed service account assertion for a backend access token (the OAuth2
 * JWT bearer grant). 5xx answers and I/O failures are retried with exponential backoff; 4xx
 * answers fail at once.
 */
@Slf4j
public record ServiceAccountTokenClient(HttpClient http, URI tokenUrl, String clientEmail, SigningKey key,
                                        String scope, Duration requestTimeout, Duration initialBackoff, Clock clock,
                                        ObjectMapper mapper) {

    static final String GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";
    static final Duration ASSERTION_TTL = Duration.ofHours(1);
    static final int MAX_ATTEMPTS = 5;
    static final long MAX_BACKOFF_MS = 8000;

    public ServiceAccountTokenClient(HttpClient http, BackendClientConfig config, SigningKey key, Clock clock) {
        this(http, config.getTokenUrl(), config.getServiceAccountEmail(), key, config.joinedScope(),
            config.getRequestTimeout(), Duration.ofMillis(500), clock,
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ServiceAccountTokenClient {
        Objects.requireNonNull(http, "http");
        Objects.requireNonNull(tokenUrl, "tokenUrl");
        Objects.requireNonNull(clientEmail, "clientEmail");
        Objects.requireNonNull(key, "key");
        scope = (scope == null || scope.isBlank()) ? null : scope;
        requestTimeout = (requestTimeout == null) ? Duration.ofSeconds(10) : requestTimeout;
        initialBackoff = (initialBackoff == null) ? Duration.ofMillis(500) : initialBackoff;
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(mapper, "mapper");
    }

    public record TokenPayload(String accessToken, long expiresIn, Instant obtainedAt) {
        public Instant expiresAt() {
            return obtainedAt.plusSeconds(expiresIn);
        }
    }

    static final class TokenResponse {
        @JsonProperty("access_token")
        String accessToken;

        @JsonProperty("expires_in")
        long expiresIn;

        @JsonProperty("token_type")
        String tokenType;
    }

    public TokenPayload fetchToken() {
        String form = "grant_type=" + URLEncoder.encode(GRANT_TYPE, StandardCharsets.UTF_8)
            + "&assertion=" + URLEncoder.encode(assertion(), StandardCharsets.UTF_8);

        HttpRequest req = HttpRequest.newBuilder(tokenUrl)
            .timeout(requestTimeout)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(form))
            .build();

        String body = sendWithRetry(req);
        TokenResponse tr;
        try {
            tr = mapper.readValue(body, TokenResponse.class);
        } catch (JsonProcessingException e) {
            throw new AuthServiceException("Invalid access token response: " + e.getOriginalMessage(), e);
        }
        if (tr.accessToken == null || tr.expiresIn <= 0) {
            throw new AuthServiceException("Invalid access token response: missing access_token or expires_in");
        }
        log.debug("Obtained backend access token for {}, valid for {} s", clientEmail, tr.expiresIn);
        return new TokenPayload(tr.accessToken, tr.expiresIn, clock.instant());
    }

    String assertion() {
        Instant now = clock.instant();
        var builder = Jwts.builder()
            .header().keyId(key.keyId()).and()
            .issuer(clientEmail)
            .audience().single(tokenUrl.toString())
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(ASSERTION_TTL)));
        if (scope != null) {
            builder.claim("scope", scope);
        }
        return builder.signWith(key.privateKey(), Jwts.SIG.RS256).compact();
    }

    private String sendWithRetry(HttpRequest req) {
        int attempts = 0;
        long backoffMs = initialBackoff.toMillis();
        while (true) {
            attempts++;
            try {
                HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
                int sc = resp.statusCode();
                if (sc >= 200 && sc < 300) {
                    return resp.body();
                }
                if (sc < 500 || attempts >= MAX_ATTEMPTS) {
                    throw new AuthServiceException(sc, "Failed to fetch access token: HTTP " + sc + " - " + resp.body());
                }
                log.warn("Token endpoint answered HTTP {} (attempt {}/{}), retrying in {} ms",
                    sc, attempts, MAX_ATTEMPTS, backoffMs);
            } catch (IOException e) {
                if (attempts >= MAX_ATTEMPTS) {
                    throw new UpstreamUnavailableException(
                        "Failed to fetch access token after " + attempts + " attempts", e);
                }
                log.warn("Token endpoint unreachable (attempt {}/{}), retrying in {} ms",
                    attempts, MAX_ATTEMPTS, backoffMs, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamUnavailableException("Interrupted while fetching access token", e);
            }
            sleep(backoffMs);
            backoffMs = Math.min(MAX_BACKOFF_MS, backoffMs * 2);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Interrupted while fetching access token", ie);
        }
    }
}
