package com.tenant.auth.server;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.tenant.auth.server.exception.UserNotFoundException;

/**
 * Keeps revocation state in memory, for tests and single-node setups without a backend.
 */
public class InMemoryUserRevocationStore implements UserLookupService, RefreshTokenRevoker {

    private final Map<String, UserRevocationState> users = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryUserRevocationStore(Clock clock) {
        this.clock = clock;
    }

    public void addUser(String uid) {
        users.putIfAbsent(uid, new UserRevocationState(uid, null));
    }

    public void removeUser(String uid) {
        users.remove(uid);
    }

    @Override
    public UserRevocationState getUser(String uid) {
        UserRevocationState state = uid == null ? null : users.get(uid);
        if (state == null) {
            throw new UserNotFoundException(uid);
        }
        return state;
    }

    /**
     * Valid-since is kept at second precision, like the {@code auth_time} it is compared with.
     */
    @Override
    public void revokeRefreshTokens(String uid) {
        var validSince = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        if (users.computeIfPresent(uid, (id, state) -> new UserRevocationState(id, validSince)) == null) {
            throw new UserNotFoundException(uid);
        }
    }
}
