package com.tenant.auth.server.exception;

import com.tenant.auth.server.token.TokenFailure;
import lombok.Getter;

/**
 * A token failed signature or claim verification.
 * <p>
 * Carries the failure kind, the offending claim (if any) and the token's {@code jti}
 * so rejections can be logged without logging the token itself.
 */
@Getter
public class InvalidTokenException extends AuthException {

    private final TokenFailure failure;
    private final String claimName;
    private final String tokenId;

    public InvalidTokenException(TokenFailure failure, String claimName, String tokenId, String message) {
        this(AuthErrorCode.INVALID_TOKEN, failure, claimName, tokenId, message);
    }

    protected InvalidTokenException(AuthErrorCode errorCode, TokenFailure failure, String claimName,
                                    String tokenId, String message) {
        super(errorCode, message);
        this.failure = failure;
        this.claimName = claimName;
        this.tokenId = tokenId;
    }
}
