package com.tenant.auth.server.token;

/**
 * Non-fatal notice about the verifier a service was built with.
 */
public record VerifierAdvisory(VerifierGeneration generation, String message) {

    public static VerifierAdvisory forDeprecated(TokenVerifier verifier) {
        return new VerifierAdvisory(verifier.generation(),
            verifier.getClass().getSimpleName() + " is deprecated, use "
                + JwtTokenVerifier.class.getSimpleName() + " instead");
    }
}
