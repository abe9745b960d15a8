package com.tenant.auth.server.token;

/**
 * Verifies a token's signature and claims.
 * <p>
 * Implementations never throw for a bad token; every rejection comes back as a
 * {@link VerificationResult}. Failures to reach the key source are thrown as
 * {@link com.tenant.auth.server.exception.AuthServiceException}.
 */
public interface TokenVerifier {

    VerificationResult verify(Token token, ValidityPolicy policy);

    default VerifierGeneration generation() {
        return VerifierGeneration.CURRENT;
    }
}
