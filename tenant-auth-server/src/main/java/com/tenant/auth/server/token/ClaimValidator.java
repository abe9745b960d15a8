package com.tenant.auth.server.token;

import java.time.Instant;
import java.util.Optional;

import com.tenant.auth.server.exception.InvalidTokenException;

/**
 * Checks the temporal and identity claims of a token against a {@link ValidityPolicy}.
 * <p>
 * Checks run in a fixed order and the first violation wins:
 * <ol>
 *   <li>{@code exp} (and the optional max age)</li>
 *   <li>{@code iat}, skipped when the policy tolerates future-issued tokens</li>
 *   <li>{@code iss}</li>
 *   <li>{@code aud}</li>
 *   <li>{@code sub}</li>
 *   <li>{@code tenant_id}, when the policy names a tenant</li>
 * </ol>
 * Callers branch on {@link TokenFailure#ISSUED_IN_FUTURE}, so it must never be reported after
 * a structural failure.
 */
public final class ClaimValidator {

    private ClaimValidator() {}

    public static Optional<ClaimViolation> validate(Token token, ValidityPolicy policy, Instant now) {
        var skew = policy.clockSkew();

        Optional<Instant> exp;
        try {
            exp = token.instantClaim(ClaimNames.EXPIRES_AT);
        } catch (InvalidTokenException e) {
            return violation(e.getFailure(), e.getClaimName(), e.getMessage());
        }
        if (exp.isEmpty()) {
            return violation(TokenFailure.EXPIRED, ClaimNames.EXPIRES_AT, "The token has no expiration time");
        }
        if (now.isAfter(exp.get().plus(skew))) {
            return violation(TokenFailure.EXPIRED, ClaimNames.EXPIRES_AT, "The token expired at " + exp.get());
        }

        Optional<Instant> iat;
        try {
            iat = token.instantClaim(ClaimNames.ISSUED_AT);
        } catch (InvalidTokenException e) {
            return violation(e.getFailure(), e.getClaimName(), e.getMessage());
        }
        if (iat.isEmpty()) {
            return violation(TokenFailure.MALFORMED, ClaimNames.ISSUED_AT, "The token has no issue time");
        }
        if (policy.maxAge() != null && now.isAfter(iat.get().plus(policy.maxAge()).plus(skew))) {
            return violation(TokenFailure.EXPIRED, ClaimNames.ISSUED_AT,
                "The token is older than " + policy.maxAge());
        }
        if (!policy.futureIssuedAllowed() && isIssuedInFuture(iat.get(), now, policy)) {
            return violation(TokenFailure.ISSUED_IN_FUTURE, ClaimNames.ISSUED_AT,
                "The token has been issued in the future at " + iat.get());
        }

        String issuer = token.stringClaim(ClaimNames.ISSUER).orElse(null);
        if (!policy.issuer().equals(issuer)) {
            return violation(TokenFailure.INVALID_ISSUER, ClaimNames.ISSUER,
                "Expected issuer \"" + policy.issuer() + "\", got \"" + issuer + "\"");
        }

        if (!token.audience().contains(policy.audience())) {
            return violation(TokenFailure.INVALID_AUDIENCE, ClaimNames.AUDIENCE,
                "Expected audience \"" + policy.audience() + "\", got " + token.audience());
        }

        String subject = token.subject();
        if (subject == null || subject.isEmpty()) {
            return violation(TokenFailure.INVALID_SUBJECT, ClaimNames.SUBJECT, "The token has no subject");
        }

        if (policy.tenantId() != null) {
            String tenant = token.stringClaim(ClaimNames.TENANT_ID).orElse(null);
            if (!policy.tenantId().equals(tenant)) {
                return violation(TokenFailure.INVALID_TENANT, ClaimNames.TENANT_ID,
                    "Expected tenant \"" + policy.tenantId() + "\", got \"" + tenant + "\"");
            }
        }

        return Optional.empty();
    }

    /**
     * The one skew-tolerant {@code iat} comparison shared by every verifier.
     */
    public static boolean isIssuedInFuture(Instant issuedAt, Instant now, ValidityPolicy policy) {
        return issuedAt.isAfter(now.plus(policy.clockSkew()));
    }

    private static Optional<ClaimViolation> violation(TokenFailure failure, String claim, String message) {
        return Optional.of(new ClaimViolation(failure, claim, message));
    }
}
