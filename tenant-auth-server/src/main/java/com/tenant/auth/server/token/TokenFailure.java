package com.tenant.auth.server.token;

/**
 * Reasons a token can fail verification.
 */
public enum TokenFailure {
    EXPIRED,
    ISSUED_IN_FUTURE,
    INVALID_ISSUER,
    INVALID_AUDIENCE,
    INVALID_SUBJECT,
    INVALID_TENANT,
    INVALID_SIGNATURE,
    UNKNOWN_KEY,
    MALFORMED
}
