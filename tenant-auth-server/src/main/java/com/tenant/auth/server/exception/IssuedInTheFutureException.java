package com.tenant.auth.server.exception;

import java.time.Instant;

import com.tenant.auth.server.token.TokenFailure;
import lombok.Getter;

/**
 * The token's {@code iat} lies beyond the tolerated clock skew.
 * <p>
 * Still an {@link InvalidTokenException}, so callers that do not care about the distinction
 * can handle both the same way.
 */
@Getter
public class IssuedInTheFutureException extends InvalidTokenException {

    private final Instant issuedAt;

    public IssuedInTheFutureException(String tokenId, Instant issuedAt) {
        super(AuthErrorCode.ISSUED_IN_THE_FUTURE, TokenFailure.ISSUED_IN_FUTURE, "iat", tokenId,
            "The token has been issued in the future (iat=" + issuedAt + ")");
        this.issuedAt = issuedAt;
    }
}
