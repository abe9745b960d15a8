package com.tenant.auth.server.token;

import java.time.Duration;
import java.util.Objects;

/**
 * What a token of one class (ID token, session token) must satisfy.
 *
 * @param maxAge   optional upper bound on {@code now - iat}; {@code null} disables the check
 * @param tenantId optional expected {@code tenant_id} claim; {@code null} disables the check
 */
public record ValidityPolicy(
    String issuer,
    String audience,
    Duration clockSkew,
    boolean futureIssuedAllowed,
    Duration maxAge,
    String tenantId
) {

    public ValidityPolicy {
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(audience, "audience");
        clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
        if (clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must not be negative");
        }
        if (maxAge != null && (maxAge.isNegative() || maxAge.isZero())) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
    }

    public static ValidityPolicy of(String issuer, String audience, Duration clockSkew) {
        return new ValidityPolicy(issuer, audience, clockSkew, false, null, null);
    }

    public ValidityPolicy withClockSkew(Duration skew) {
        return new ValidityPolicy(issuer, audience, skew, futureIssuedAllowed, maxAge, tenantId);
    }

    public ValidityPolicy withFutureIssuedAllowed(boolean allowed) {
        return new ValidityPolicy(issuer, audience, clockSkew, allowed, maxAge, tenantId);
    }

    public ValidityPolicy withMaxAge(Duration age) {
        return new ValidityPolicy(issuer, audience, clockSkew, futureIssuedAllowed, age, tenantId);
    }

    public ValidityPolicy withTenantId(String tenant) {
        return new ValidityPolicy(issuer, audience, clockSkew, futureIssuedAllowed, maxAge, tenant);
    }
}
