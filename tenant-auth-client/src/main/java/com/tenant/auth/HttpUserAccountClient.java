package com.tenant.auth;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenant.auth.server.RefreshTokenRevoker;
import com.tenant.auth.server.UserLookupService;
import com.tenant.auth.server.UserRevocationState;
import com.tenant.auth.server.exception.AuthServiceException;
import com.tenant.auth.server.exception.UserNotFoundException;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads and moves a user's valid-since time through the backend's account endpoints.
 */
@Slf4j
public class HttpUserAccountClient implements UserLookupService, RefreshTokenRevoker {

    private final BackendHttp backend;
    private final URI lookupUri;
    private final URI updateUri;
    private final Clock clock;

    public HttpUserAccountClient(BackendClientConfig config, HttpClient http, BackendCredentials credentials,
                                 Clock clock) {
        this.backend = new BackendHttp(http, credentials, config.getRequestTimeout());
        this.lookupUri = URI.create(config.projectResource() + "/accounts:lookup");
        this.updateUri = URI.create(config.projectResource() + "/accounts:update");
        this.clock = clock;
    }

    @Override
    public UserRevocationState getUser(String uid) {
        String body = backend.postJson(lookupUri, Map.of("localId", List.of(uid)), "User lookup");
        JsonNode users = BackendHttp.readTree(body, "User lookup").path("users");
        if (!users.isArray() || users.isEmpty()) {
            throw new UserNotFoundException(uid);
        }
        return new UserRevocationState(uid, validSince(users.get(0)));
    }

    @Override
    public void revokeRefreshTokens(String uid) {
        String validSince = String.valueOf(clock.instant().getEpochSecond());
        try {
            backend.postJson(updateUri, Map.of("localId", uid, "validSince", validSince), "Refresh token revocation");
        } catch (AuthServiceException e) {
            if (e.getHttpStatus() == 400 && String.valueOf(e.getMessage()).contains("USER_NOT_FOUND")) {
                throw new UserNotFoundException(uid);
            }
            throw e;
        }
        log.debug("Moved valid-since of uid={} to {}", uid, validSince);
    }

    private static Instant validSince(JsonNode user) {
        JsonNode value = user.get("validSince");
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            long seconds = value.isNumber() ? value.asLong() : Long.parseLong(value.asText());
            return Instant.ofEpochSecond(seconds);
        } catch (NumberFormatException e) {
            throw new AuthServiceException("User lookup: unexpected validSince \"" + value.asText() + "\"", e);
        }
    }
}
