package com.tenant.auth.server.token;

import java.time.Instant;

import com.tenant.auth.server.exception.InvalidSignatureException;
import com.tenant.auth.server.exception.InvalidTokenException;
import com.tenant.auth.server.exception.UnknownSigningKeyException;

/**
 * Outcome of {@link TokenVerifier#verify(Token, ValidityPolicy)}.
 */
public sealed interface VerificationResult {

    Token token();

    /**
     * Signature and claims are valid.
     */
    record Verified(Token token) implements VerificationResult {}

    /**
     * Signature is valid and the token has not expired, but its {@code iat} lies beyond the
     * tolerated skew. The remaining claims have not necessarily been checked.
     */
    record IssuedInFuture(Token token, Instant issuedAt) implements VerificationResult {}

    record Rejected(Token token, ClaimViolation violation) implements VerificationResult {

        public InvalidTokenException toException() {
            return switch (violation.failure()) {
                case UNKNOWN_KEY -> new UnknownSigningKeyException(token.keyId().orElse(null), token.tokenId());
                case INVALID_SIGNATURE -> new InvalidSignatureException(token.tokenId(), violation.message());
                default -> new InvalidTokenException(
                    violation.failure(), violation.claimName(), token.tokenId(), violation.message());
            };
        }
    }
}
