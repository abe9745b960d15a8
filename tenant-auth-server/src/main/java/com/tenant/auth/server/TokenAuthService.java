package com.tenant.auth.server;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import com.tenant.auth.server.exception.AuthException;
import com.tenant.auth.server.exception.AuthServiceException;
import com.tenant.auth.server.exception.InvalidArgumentException;
import com.tenant.auth.server.exception.InvalidTokenException;
import com.tenant.auth.server.exception.IssuedInTheFutureException;
import com.tenant.auth.server.exception.RevokedIdTokenException;
import com.tenant.auth.server.exception.RevokedSessionTokenException;
import com.tenant.auth.server.exception.TokenParseException;
import com.tenant.auth.server.key.SigningKeySource;
import com.tenant.auth.server.token.ClaimNames;
import com.tenant.auth.server.token.ClaimValidator;
import com.tenant.auth.server.token.JwtTokenVerifier;
import com.tenant.auth.server.token.Token;
import com.tenant.auth.server.token.TokenFailure;
import com.tenant.auth.server.token.TokenVerifier;
import com.tenant.auth.server.token.ValidityPolicy;
import com.tenant.auth.server.token.VerificationResult;
import com.tenant.auth.server.token.VerifierAdvisory;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for minting and verifying tokens.
 * <p>
 * Every method accepts either a {@link Token} or its compact string; strings are parsed once on
 * the way in and a parse failure is an {@link InvalidArgumentException}. Everything thrown is an
 * {@link AuthException}.
 * <p>
 * Verification walks parse, signature, claims and (optionally) revocation, in that order, and
 * stops at the first failure. Nothing is kept between calls.
 */
@Slf4j
public class TokenAuthService {

    private final CustomTokenMinter customTokenMinter;
    private final TokenVerifier idTokenVerifier;
    private final TokenVerifier sessionTokenVerifier;
    private final RevocationChecker revocationChecker;
    private final SessionCookieMinter sessionCookieMinter;
    private final RefreshTokenRevoker refreshTokenRevoker;
    private final ValidityPolicy idTokenPolicy;
    private final ValidityPolicy sessionTokenPolicy;
    private final Clock clock;
    private final VerifierAdvisory verifierAdvisory;

    public TokenAuthService(TokenAuthConfig config,
                            CustomTokenMinter customTokenMinter,
                            TokenVerifier idTokenVerifier,
                            TokenVerifier sessionTokenVerifier,
                            RevocationChecker revocationChecker,
                            SessionCookieMinter sessionCookieMinter,
                            RefreshTokenRevoker refreshTokenRevoker,
                            Clock clock) {
        this.customTokenMinter = Objects.requireNonNull(customTokenMinter, "customTokenMinter");
        this.idTokenVerifier = Objects.requireNonNull(idTokenVerifier, "idTokenVerifier");
        this.sessionTokenVerifier = Objects.requireNonNull(sessionTokenVerifier, "sessionTokenVerifier");
        this.revocationChecker = Objects.requireNonNull(revocationChecker, "revocationChecker");
        this.sessionCookieMinter = Objects.requireNonNull(sessionCookieMinter, "sessionCookieMinter");
        this.refreshTokenRevoker = Objects.requireNonNull(refreshTokenRevoker, "refreshTokenRevoker");
        this.idTokenPolicy = config.idTokenPolicy();
        this.sessionTokenPolicy = config.sessionTokenPolicy();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.verifierAdvisory = idTokenVerifier.generation().isDeprecated()
            ? VerifierAdvisory.forDeprecated(idTokenVerifier)
            : null;
    }

    /**
     * Wires the default components: RS256 minting with {@code idTokenKeys}' signing key and the
     * current verifier for both token classes.
     */
    public static <U extends UserLookupService & RefreshTokenRevoker> TokenAuthService create(
        TokenAuthConfig config,
        SigningKeySource idTokenKeys,
        SigningKeySource sessionTokenKeys,
        U users,
        SessionExchangeEndpoint sessionExchange,
        Clock clock) {
        return new TokenAuthService(config,
            new RsaCustomTokenMinter(idTokenKeys, config, clock),
            new JwtTokenVerifier(idTokenKeys, clock),
            new JwtTokenVerifier(sessionTokenKeys, clock),
            new RevocationChecker(users),
            new SessionCookieMinter(sessionExchange),
            users,
            clock);
    }

    /**
     * Present when the ID token verifier is of a deprecated generation.
     */
    public Optional<VerifierAdvisory> verifierAdvisory() {
        return Optional.ofNullable(verifierAdvisory);
    }

    public Token mintCustomToken(String uid) {
        return mintCustomToken(uid, Map.of());
    }

    public Token mintCustomToken(String uid, Map<String, ?> claims) {
        return translate("Custom token minting", () -> customTokenMinter.mint(uid, claims));
    }

    public Token verifyIdToken(String idToken) {
        return verifyIdToken(parseArgument(idToken), false, false);
    }

    public Token verifyIdToken(String idToken, boolean checkRevoked, boolean allowFutureTokens) {
        return verifyIdToken(parseArgument(idToken), checkRevoked, allowFutureTokens);
    }

    /**
     * @return the given token, unchanged
     * @throws IssuedInTheFutureException if {@code iat} is in the future and {@code allowFutureTokens} is false
     * @throws InvalidTokenException      on any other signature or claim failure
     * @throws RevokedIdTokenException    if {@code checkRevoked} and the user's tokens were revoked since
     */
    public Token verifyIdToken(Token idToken, boolean checkRevoked, boolean allowFutureTokens) {
        requireToken(idToken);
        ValidityPolicy policy = idTokenPolicy.withFutureIssuedAllowed(allowFutureTokens);
        VerificationResult result = translate("ID token verification", () -> idTokenVerifier.verify(idToken, policy));

        if (result instanceof VerificationResult.IssuedInFuture future) {
            if (!allowFutureTokens) {
                throw new IssuedInTheFutureException(idToken.tokenId(), future.issuedAt());
            }
            // the verifier stopped at iat, the remaining claims still have to hold
            ClaimValidator.validate(idToken, policy, clock.instant()).ifPresent(violation -> {
                throw new VerificationResult.Rejected(idToken, violation).toException();
            });
        } else if (result instanceof VerificationResult.Rejected rejected) {
            throw rejected.toException();
        }

        if (checkRevoked && isRevoked(idToken)) {
            throw new RevokedIdTokenException(idToken.subject(), idToken.tokenId());
        }
        return idToken;
    }

    public void verifySessionToken(String sessionToken) {
        verifySessionToken(parseArgument(sessionToken), false, null);
    }

    public void verifySessionToken(String sessionToken, boolean checkRevoked, Duration leeway) {
        verifySessionToken(parseArgument(sessionToken), checkRevoked, leeway);
    }

    /**
     * Unlike ID tokens, a session token issued in the future is always rejected.
     *
     * @param leeway clock skew to tolerate instead of the configured one; {@code null} keeps the default
     */
    public void verifySessionToken(Token sessionToken, boolean checkRevoked, Duration leeway) {
        requireToken(sessionToken);
        if (leeway != null && leeway.isNegative()) {
            throw new InvalidArgumentException("The leeway must not be negative, got " + leeway);
        }
        ValidityPolicy policy = leeway == null ? sessionTokenPolicy : sessionTokenPolicy.withClockSkew(leeway);
        VerificationResult result = translate("Session token verification",
            () -> sessionTokenVerifier.verify(sessionToken, policy));

        if (result instanceof VerificationResult.IssuedInFuture future) {
            throw new InvalidTokenException(TokenFailure.ISSUED_IN_FUTURE, ClaimNames.ISSUED_AT,
                sessionToken.tokenId(), "The session token has been issued in the future at " + future.issuedAt());
        }
        if (result instanceof VerificationResult.Rejected rejected) {
            throw rejected.toException();
        }

        if (checkRevoked && isRevoked(sessionToken)) {
            throw new RevokedSessionTokenException(sessionToken.subject(), sessionToken.tokenId());
        }
    }

    public Token mintSessionToken(String idToken) {
        return mintSessionToken(idToken, null);
    }

    public Token mintSessionToken(String idToken, Duration lifetime) {
        return mintSessionToken(parseArgument(idToken), lifetime);
    }

    /**
     * @param lifetime between 5 minutes and 2 weeks; {@code null} means 5 minutes
     */
    public Token mintSessionToken(Token idToken, Duration lifetime) {
        requireToken(idToken);
        SessionLifetime sessionLifetime = SessionLifetime.of(lifetime);
        return translate("Session cookie minting", () -> sessionCookieMinter.mintSession(idToken, sessionLifetime));
    }

    public boolean isRevoked(String token) {
        return isRevoked(parseArgument(token));
    }

    public boolean isRevoked(Token token) {
        requireToken(token);
        return translate("Revocation check", () -> revocationChecker.isRevoked(token));
    }

    public void revokeRefreshTokens(String uid) {
        if (uid == null || uid.isEmpty()) {
            throw new InvalidArgumentException("The uid must not be empty");
        }
        translate("Refresh token revocation", () -> {
            refreshTokenRevoker.revokeRefreshTokens(uid);
            return null;
        });
        log.info("Revoked refresh tokens of uid={}", uid);
    }

    private static Token parseArgument(String value) {
        try {
            return Token.parse(value);
        } catch (TokenParseException e) {
            throw new InvalidArgumentException("The given value could not be parsed as a token: " + e.getMessage(), e);
        }
    }

    private static void requireToken(Token token) {
        if (token == null) {
            throw new InvalidArgumentException("The token must not be null");
        }
    }

    private static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (AuthException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuthServiceException(operation + " failed: " + e.getMessage(), e);
        }
    }
}
