package com.tenant.auth.server.token;

import static com.tenant.auth.server.TokenFixtures.CLOCK;
import static com.tenant.auth.server.TokenFixtures.ID_ISSUER;
import static com.tenant.auth.server.TokenFixtures.NOW;
import static com.tenant.auth.server.TokenFixtures.OTHER_KEY_PAIR;
import static com.tenant.auth.server.TokenFixtures.PROJECT;
import static com.tenant.auth.server.TokenFixtures.idToken;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Optional;

import com.tenant.auth.server.TokenFixtures;
import com.tenant.auth.server.exception.UnknownSigningKeyException;
import com.tenant.auth.server.exception.UpstreamUnavailableException;
import com.tenant.auth.server.key.SigningKeySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("JwtTokenVerifier")
class JwtTokenVerifierTest {

    private static final ValidityPolicy POLICY = ValidityPolicy.of(ID_ISSUER, PROJECT, Duration.ofSeconds(30));

    private JwtTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new JwtTokenVerifier(TokenFixtures.keySource(), CLOCK);
    }

    private static ClaimViolation violationOf(VerificationResult result) {
        return assertInstanceOf(VerificationResult.Rejected.class, result).violation();
    }

    @Test
    @DisplayName("should report the current generation")
    void shouldReportCurrentGeneration() {
        assertEquals(VerifierGeneration.CURRENT, verifier.generation());
    }

    @Test
    @DisplayName("should verify a correctly signed token and return it unchanged")
    void shouldVerifyCorrectlySignedToken() {
        final var token = idToken().token();

        final var result = verifier.verify(token, POLICY);

        final var verified = assertInstanceOf(VerificationResult.Verified.class, result);
        assertSame(token, verified.token());
    }

    @Nested
    @DisplayName("signature")
    class SignatureTests {

        @Test
        @DisplayName("should reject a token signed with another key")
        void shouldRejectForeignSignature() {
            final var token = idToken().signedWith(OTHER_KEY_PAIR.getPrivate()).token();

            assertEquals(TokenFailure.INVALID_SIGNATURE, violationOf(verifier.verify(token, POLICY)).failure());
        }

        @Test
        @DisplayName("should reject an unknown key id")
        void shouldRejectUnknownKeyId() {
            final var token = idToken().header("kid", "key-2").token();

            final var rejected = assertInstanceOf(VerificationResult.Rejected.class, verifier.verify(token, POLICY));

            assertEquals(TokenFailure.UNKNOWN_KEY, rejected.violation().failure());
            final var exception = assertInstanceOf(UnknownSigningKeyException.class, rejected.toException());
            assertEquals("key-2", exception.getKeyId());
        }

        @Test
        @DisplayName("should reject a token without key id")
        void shouldRejectMissingKeyId() {
            final var token = idToken().header("kid", null).token();

            assertEquals(TokenFailure.MALFORMED, violationOf(verifier.verify(token, POLICY)).failure());
        }

        @Test
        @DisplayName("should reject any algorithm but RS256")
        void shouldRejectOtherAlgorithms() {
            final var token = idToken().header("alg", "HS256").token();

            final var violation = violationOf(verifier.verify(token, POLICY));

            assertEquals(TokenFailure.MALFORMED, violation.failure());
            assertEquals("alg", violation.claimName());
        }
    }

    @Nested
    @DisplayName("claims")
    class ClaimTests {

        @Test
        @DisplayName("should reject an expired token")
        void shouldRejectExpiredToken() {
            final var token = idToken().expiresAt(NOW.minusSeconds(3600)).token();

            assertEquals(TokenFailure.EXPIRED, violationOf(verifier.verify(token, POLICY)).failure());
        }

        @Test
        @DisplayName("should signal a token issued in the future")
        void shouldSignalFutureIssuedToken() {
            final var token = idToken().issuedAt(NOW.plusSeconds(600)).token();

            final var result = verifier.verify(token, POLICY);

            final var future = assertInstanceOf(VerificationResult.IssuedInFuture.class, result);
            assertEquals(NOW.plusSeconds(600), future.issuedAt());
        }

        @Test
        @DisplayName("should verify a future token when the policy tolerates it")
        void shouldVerifyToleratedFutureToken() {
            final var token = idToken().issuedAt(NOW.plusSeconds(600)).token();

            assertInstanceOf(VerificationResult.Verified.class,
                verifier.verify(token, POLICY.withFutureIssuedAllowed(true)));
        }

        @Test
        @DisplayName("should honour a clock skew with a fraction of a second")
        void shouldHonourSubSecondSkew() {
            final var precise = new JwtTokenVerifier(TokenFixtures.keySource(), Clock.fixed(NOW.plusMillis(700), ZoneOffset.UTC));
            final var token = idToken().expiresAt(NOW.minusSeconds(1)).token();

            assertInstanceOf(VerificationResult.Verified.class,
                precise.verify(token, POLICY.withClockSkew(Duration.ofMillis(1900))));
            assertEquals(TokenFailure.EXPIRED,
                violationOf(precise.verify(token, POLICY.withClockSkew(Duration.ofMillis(1500)))).failure());
        }

        @Test
        @DisplayName("should round a fractional skew up to whole seconds for the signature check")
        void shouldRoundSkewUp() {
            assertEquals(0, JwtTokenVerifier.clockSkewSeconds(Duration.ZERO));
            assertEquals(2, JwtTokenVerifier.clockSkewSeconds(Duration.ofMillis(1001)));
            assertEquals(30, JwtTokenVerifier.clockSkewSeconds(Duration.ofSeconds(30)));
        }

        @Test
        @DisplayName("should reject a token of another issuer")
        void shouldRejectOtherIssuer() {
            final var token = idToken().claim("iss", "https://other.example.com").token();

            assertEquals(TokenFailure.INVALID_ISSUER, violationOf(verifier.verify(token, POLICY)).failure());
        }
    }

    @Nested
    @DisplayName("key source failures")
    @ExtendWith(MockitoExtension.class)
    class KeySourceFailureTests {

        @Mock
        private SigningKeySource keySource;

        @Test
        @DisplayName("should propagate an unreachable key source")
        void shouldPropagateUnreachableKeySource() {
            when(keySource.findVerificationKey("key-1"))
                .thenThrow(new UpstreamUnavailableException("timeout", null));
            final var failing = new JwtTokenVerifier(keySource, CLOCK);

            assertThrows(UpstreamUnavailableException.class, () -> failing.verify(idToken().token(), POLICY));
        }

        @Test
        @DisplayName("should reject when the key source does not know the key")
        void shouldRejectWhenKeyUnknown() {
            when(keySource.findVerificationKey("key-1")).thenReturn(Optional.empty());
            final var failing = new JwtTokenVerifier(keySource, CLOCK);

            assertEquals(TokenFailure.UNKNOWN_KEY, violationOf(failing.verify(idToken().token(), POLICY)).failure());
        }
    }
}
