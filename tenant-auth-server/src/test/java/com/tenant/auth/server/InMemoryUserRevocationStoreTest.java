package com.tenant.auth.server;

import static com.tenant.auth.server.TokenFixtures.CLOCK;
import static com.tenant.auth.server.TokenFixtures.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.time.ZoneOffset;

import com.tenant.auth.server.exception.UserNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryUserRevocationStore")
class InMemoryUserRevocationStoreTest {

    private InMemoryUserRevocationStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryUserRevocationStore(CLOCK);
        store.addUser("alice");
    }

    @Test
    @DisplayName("should start without valid-since")
    void shouldStartUnrevoked() {
        assertNull(store.getUser("alice").tokensValidAfterTime());
    }

    @Test
    @DisplayName("should set valid-since to now at second precision")
    void shouldRevokeAtSecondPrecision() {
        final var precise = new InMemoryUserRevocationStore(Clock.fixed(NOW.plusMillis(750), ZoneOffset.UTC));
        precise.addUser("alice");

        precise.revokeRefreshTokens("alice");

        assertEquals(NOW, precise.getUser("alice").tokensValidAfterTime());
    }

    @Test
    @DisplayName("should not know removed or never added users")
    void shouldRejectUnknownUsers() {
        store.removeUser("alice");

        assertThrows(UserNotFoundException.class, () -> store.getUser("alice"));
        assertThrows(UserNotFoundException.class, () -> store.revokeRefreshTokens("bob"));
    }
}
