package com.tenant.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

/**
 * The service account's backend access token, fetched on first use and again {@code skew}
 * before it expires. A failed early refresh keeps the cached token while it is still valid.
 */
@Slf4j
public class BackendCredentials {

    private final ServiceAccountTokenClient client;
    private final AtomicReference<ServiceAccountTokenClient.TokenPayload> cache = new AtomicReference<>();
    private final Duration skew;
    private final Clock clock;

    public BackendCredentials(ServiceAccountTokenClient client, Duration skew) {
        this.client = client;
        this.skew = (skew == null) ? Duration.ofSeconds(30) : skew;
        this.clock = client.clock();
    }

    public String currentToken() {
        var current = cache.get();
        if (current != null && !isExpiring(current)) {
            return current.accessToken();
        }
        synchronized (this) {
            current = cache.get();
            if (current != null && !isExpiring(current)) {
                return current.accessToken();
            }
            try {
                var fresh = client.fetchToken();
                cache.set(fresh);
                return fresh.accessToken();
            } catch (RuntimeException e) {
                if (current == null || !clock.instant().isBefore(current.expiresAt())) {
                    throw e;
                }
                log.warn("Failed to refresh backend access token, keeping the one valid until {}",
                    current.expiresAt(), e);
                return current.accessToken();
            }
        }
    }

    private boolean isExpiring(ServiceAccountTokenClient.TokenPayload token) {
        return token.expiresAt().minus(skew).isBefore(clock.instant());
    }
}
