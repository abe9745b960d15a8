package com.tenant.auth.server.exception;

import lombok.Getter;

@Getter
public enum AuthErrorCode {
    INVALID_ARGUMENT("invalid-argument", "The given value is not acceptable"),
    INVALID_TOKEN("invalid-token", "The token could not be verified"),
    UNKNOWN_KEY("unknown-key", "The token was signed with an unknown key"),
    INVALID_SIGNATURE("invalid-signature", "The token signature does not match"),
    ISSUED_IN_THE_FUTURE("issued-in-the-future", "The token has been issued in the future"),
    REVOKED_ID_TOKEN("revoked-id-token", "The ID token has been revoked"),
    REVOKED_SESSION_TOKEN("revoked-session-token", "The session has been revoked"),
    USER_NOT_FOUND("user-not-found", "No such user"),
    AUTH_SERVICE_ERROR("auth-service-error", "The auth backend returned an error"),
    UPSTREAM_UNAVAILABLE("upstream-unavailable", "The auth backend could not be reached"),
    TOKEN_PARSE_ERROR("token-parse-error", "The value is not a compact signed token");

    private final String code;
    private final String defaultMessage;

    AuthErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}
