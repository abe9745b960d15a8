package com.tenant.auth.server.key;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.tenant.auth.server.TokenFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SigningKeyRefresher")
class SigningKeyRefresherTest {

    @Test
    @DisplayName("should load the public keys right after start")
    void shouldRefreshOnStart() throws Exception {
        final var fetched = new CountDownLatch(1);
        final var keySource = new CachingSigningKeySource(null, () -> {
            fetched.countDown();
            return TokenFixtures.publicKeys();
        }, TokenFixtures.CLOCK, Duration.ofSeconds(5), Duration.ofMinutes(1));

        try (var ignored = new SigningKeyRefresher(keySource, Duration.ofHours(1))) {
            assertTrue(fetched.await(5, TimeUnit.SECONDS));
        }
    }
}
