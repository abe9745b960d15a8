package com.tenant.auth.server.token;

import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;
import java.util.Optional;

import com.tenant.auth.server.key.SigningKeySource;
import com.tenant.auth.server.key.VerificationKey;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;

/**
 * RS256 verifier using JJWT for the signature and {@link ClaimValidator} for the claims.
 */
@Slf4j
public final class JwtTokenVerifier implements TokenVerifier {

    static final String ALGORITHM = "RS256";

    private final SigningKeySource keySource;
    private final Clock clock;

    public JwtTokenVerifier(SigningKeySource keySource, Clock clock) {
        this.keySource = keySource;
        this.clock = clock;
    }

    @Override
    public VerificationResult verify(Token token, ValidityPolicy policy) {
        if (!ALGORITHM.equals(token.algorithm())) {
            return reject(token, TokenFailure.MALFORMED, "alg",
                "Expected algorithm " + ALGORITHM + ", got " + token.algorithm());
        }
        Optional<String> keyId = token.keyId();
        if (keyId.isEmpty()) {
            return reject(token, TokenFailure.MALFORMED, "kid", "The token has no key id");
        }
        Optional<VerificationKey> key = keySource.findVerificationKey(keyId.get());
        if (key.isEmpty()) {
            return reject(token, TokenFailure.UNKNOWN_KEY, "kid", "Unknown key id " + keyId.get());
        }

        try {
            checkSignature(token, key.get().publicKey(), policy);
        } catch (ExpiredJwtException e) {
            return reject(token, TokenFailure.EXPIRED, ClaimNames.EXPIRES_AT, e.getMessage());
        } catch (SignatureException e) {
            return reject(token, TokenFailure.INVALID_SIGNATURE, null, e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            return reject(token, TokenFailure.MALFORMED, null, e.getMessage());
        }

        var violation = ClaimValidator.validate(token, policy, clock.instant());
        if (violation.isEmpty()) {
            return new VerificationResult.Verified(token);
        }
        if (violation.get().failure() == TokenFailure.ISSUED_IN_FUTURE) {
            return new VerificationResult.IssuedInFuture(token, token.instantClaim(ClaimNames.ISSUED_AT).orElseThrow());
        }
        return reject(token, violation.get());
    }

    private void checkSignature(Token token, PublicKey key, ValidityPolicy policy) {
        Jwts.parser()
            .verifyWith(key)
            .clock(() -> Date.from(clock.instant()))
            .clockSkewSeconds(clockSkewSeconds(policy.clockSkew()))
            .build()
            .parseSignedClaims(token.compact());
    }

    /**
     * JJWT takes whole seconds; rounding up keeps it from rejecting what {@link ClaimValidator} accepts.
     */
    static long clockSkewSeconds(Duration skew) {
        return (skew.toMillis() + 999) / 1000;
    }

    private static VerificationResult reject(Token token, TokenFailure failure, String claim, String message) {
        return reject(token, new ClaimViolation(failure, claim, message));
    }

    private static VerificationResult reject(Token token, ClaimViolation violation) {
        log.debug("Rejected token jti={} kid={}: {} ({})", token.tokenId(), token.keyId().orElse(null),
            violation.failure(), violation.claimName());
        return new VerificationResult.Rejected(token, violation);
    }
}
