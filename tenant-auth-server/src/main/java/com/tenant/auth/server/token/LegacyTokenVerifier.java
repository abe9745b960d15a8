package com.tenant.auth.server.token;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Set;

import com.tenant.auth.server.exception.InvalidSignatureException;
import com.tenant.auth.server.exception.InvalidTokenException;
import com.tenant.auth.server.exception.IssuedInTheFutureException;
import com.tenant.auth.server.exception.UnknownSigningKeyException;
import com.tenant.auth.server.key.SigningKeySource;
import com.tenant.auth.server.key.VerificationKey;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SignatureException;

/**
 * The first-generation ID token verifier. Every failure is thrown; a token issued in the
 * future raises {@link IssuedInTheFutureException} as soon as its signature and expiry check out,
 * without looking at the remaining claims.
 * <p>
 * Wrap it in a {@link LegacyTokenVerifierAdapter} to use it as a {@link TokenVerifier}.
 *
 * @deprecated use {@link JwtTokenVerifier}
 */
@Deprecated
public class LegacyTokenVerifier {

    private final SigningKeySource keySource;
    private final Clock clock;

    public LegacyTokenVerifier(SigningKeySource keySource, Clock clock) {
        this.keySource = keySource;
        this.clock = clock;
    }

    /**
     * @return the verified claims
     * @throws InvalidTokenException (or one of its subtypes) when the token is not acceptable
     */
    public Claims verify(Token token, ValidityPolicy policy) {
        String keyId = token.keyId()
            .orElseThrow(() -> invalid(token, TokenFailure.MALFORMED, "kid", "The token has no key id"));
        if (!JwtTokenVerifier.ALGORITHM.equals(token.algorithm())) {
            throw invalid(token, TokenFailure.MALFORMED, "alg", "Unsupported algorithm " + token.algorithm());
        }
        VerificationKey key = keySource.findVerificationKey(keyId)
            .orElseThrow(() -> new UnknownSigningKeyException(keyId, token.tokenId()));

        Claims claims;
        try {
            claims = Jwts.parser()
                .verifyWith(key.publicKey())
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(JwtTokenVerifier.clockSkewSeconds(policy.clockSkew()))
                .build()
                .parseSignedClaims(token.compact())
                .getPayload();
        } catch (ExpiredJwtException e) {
            throw invalid(token, TokenFailure.EXPIRED, ClaimNames.EXPIRES_AT, e.getMessage());
        } catch (SignatureException e) {
            throw new InvalidSignatureException(token.tokenId(), e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            throw invalid(token, TokenFailure.MALFORMED, null, e.getMessage());
        }

        Instant now = clock.instant();
        if (claims.getExpiration() == null) {
            throw invalid(token, TokenFailure.EXPIRED, ClaimNames.EXPIRES_AT, "The token has no expiration time");
        }
        if (now.isAfter(claims.getExpiration().toInstant().plus(policy.clockSkew()))) {
            throw invalid(token, TokenFailure.EXPIRED, ClaimNames.EXPIRES_AT,
                "The token expired at " + claims.getExpiration().toInstant());
        }
        if (claims.getIssuedAt() == null) {
            throw invalid(token, TokenFailure.MALFORMED, ClaimNames.ISSUED_AT, "The token has no issue time");
        }
        Instant issuedAt = claims.getIssuedAt().toInstant();
        if (policy.maxAge() != null && now.isAfter(issuedAt.plus(policy.maxAge()).plus(policy.clockSkew()))) {
            throw invalid(token, TokenFailure.EXPIRED, ClaimNames.ISSUED_AT, "The token is older than " + policy.maxAge());
        }
        if (ClaimValidator.isIssuedInFuture(issuedAt, now, policy)) {
            throw new IssuedInTheFutureException(token.tokenId(), issuedAt);
        }
        if (!policy.issuer().equals(claims.getIssuer())) {
            throw invalid(token, TokenFailure.INVALID_ISSUER, ClaimNames.ISSUER, "Unexpected issuer " + claims.getIssuer());
        }
        Set<String> audience = claims.getAudience();
        if (audience == null || !audience.contains(policy.audience())) {
            throw invalid(token, TokenFailure.INVALID_AUDIENCE, ClaimNames.AUDIENCE, "Unexpected audience " + audience);
        }
        if (claims.getSubject() == null || claims.getSubject().isEmpty()) {
            throw invalid(token, TokenFailure.INVALID_SUBJECT, ClaimNames.SUBJECT, "The token has no subject");
        }
        if (policy.tenantId() != null && !policy.tenantId().equals(claims.get(ClaimNames.TENANT_ID, String.class))) {
            throw invalid(token, TokenFailure.INVALID_TENANT, ClaimNames.TENANT_ID, "Unexpected tenant");
        }
        return claims;
    }

    private static InvalidTokenException invalid(Token token, TokenFailure failure, String claim, String message) {
        return new InvalidTokenException(failure, claim, token.tokenId(), message);
    }
}
