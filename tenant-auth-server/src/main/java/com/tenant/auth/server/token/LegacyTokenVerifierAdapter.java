package com.tenant.auth.server.token;

import com.tenant.auth.server.exception.InvalidTokenException;
import com.tenant.auth.server.exception.IssuedInTheFutureException;

/**
 * Presents a {@link LegacyTokenVerifier} as a {@link TokenVerifier}, turning its exceptions
 * into {@link VerificationResult}s.
 */
@SuppressWarnings("deprecation")
public final class LegacyTokenVerifierAdapter implements TokenVerifier {

    private final LegacyTokenVerifier delegate;

    public LegacyTokenVerifierAdapter(LegacyTokenVerifier delegate) {
        this.delegate = delegate;
    }

    @Override
    public VerificationResult verify(Token token, ValidityPolicy policy) {
        try {
            delegate.verify(token, policy);
            return new VerificationResult.Verified(token);
        } catch (IssuedInTheFutureException e) {
            return new VerificationResult.IssuedInFuture(token, e.getIssuedAt());
        } catch (InvalidTokenException e) {
            return new VerificationResult.Rejected(token,
                new ClaimViolation(e.getFailure(), e.getClaimName(), e.getMessage()));
        }
    }

    @Override
    public VerifierGeneration generation() {
        return VerifierGeneration.LEGACY;
    }
}
