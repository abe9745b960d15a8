package com.tenant.auth.server;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.Signature;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenant.auth.server.key.CachingSigningKeySource;
import com.tenant.auth.server.key.PemKeyLoader;
import com.tenant.auth.server.key.PublicKeySet;
import com.tenant.auth.server.key.SigningKey;
import com.tenant.auth.server.key.VerificationKey;
import com.tenant.auth.server.token.Token;

/**
 * Shared keys, clock and a hand-rolled RS256 token builder for tests.
 */
public final class TokenFixtures {

    public static final String KEY_ID = "key-1";
    public static final String PROJECT = "project-1";
    public static final String ID_ISSUER = "https://securetoken.google.com/" + PROJECT;
    public static final String SESSION_ISSUER = "https://session.firebase.google.com/" + PROJECT;
    public static final String CUSTOM_ISSUER = "minter@project-1.iam.example.com";
    public static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    public static final KeyPair KEY_PAIR = PemKeyLoader.generateRsaKeyPair(2048);
    public static final KeyPair OTHER_KEY_PAIR = PemKeyLoader.generateRsaKeyPair(2048);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TokenFixtures() {}

    public static TokenAuthConfig config() {
        TokenAuthConfig config = TokenAuthConfig.forProject(PROJECT);
        config.setCustomTokenIssuer(CUSTOM_ISSUER);
        return config;
    }

    public static SigningKey signingKey() {
        return new SigningKey(KEY_ID, KEY_PAIR.getPrivate());
    }

    public static PublicKeySet publicKeys() {
        return PublicKeySet.of(List.of(new VerificationKey(KEY_ID, KEY_PAIR.getPublic())), NOW.plus(Duration.ofHours(1)));
    }

    /**
     * A key source that knows {@link #KEY_ID} and fetches on the calling thread.
     */
    public static CachingSigningKeySource keySource() {
        return new CachingSigningKeySource(signingKey(), TokenFixtures::publicKeys, CLOCK,
            Duration.ofSeconds(5), Duration.ofMinutes(1), Runnable::run);
    }

    public static Builder idToken() {
        return new Builder(ID_ISSUER);
    }

    public static Builder sessionToken() {
        return new Builder(SESSION_ISSUER);
    }

    public static final class Builder {
        private final Map<String, Object> header = new LinkedHashMap<>();
        private final Map<String, Object> claims = new LinkedHashMap<>();
        private PrivateKey key = KEY_PAIR.getPrivate();

        private Builder(String issuer) {
            header.put("alg", "RS256");
            header.put("kid", KEY_ID);
            header.put("typ", "JWT");
            claims.put("iss", issuer);
            claims.put("aud", PROJECT);
            claims.put("sub", "alice");
            claims.put("iat", NOW.minusSeconds(60).getEpochSecond());
            claims.put("exp", NOW.plusSeconds(3600).getEpochSecond());
            claims.put("auth_time", NOW.minusSeconds(120).getEpochSecond());
        }

        public Builder claim(String name, Object value) {
            claims.put(name, value);
            return this;
        }

        public Builder without(String name) {
            claims.remove(name);
            return this;
        }

        public Builder issuedAt(Instant at) {
            return claim("iat", at.getEpochSecond());
        }

        public Builder expiresAt(Instant at) {
            return claim("exp", at.getEpochSecond());
        }

        public Builder authTime(Instant at) {
            return claim("auth_time", at.getEpochSecond());
        }

        public Builder header(String name, Object value) {
            header.put(name, value);
            return this;
        }

        public Builder signedWith(PrivateKey privateKey) {
            this.key = privateKey;
            return this;
        }

        public String compact() {
            try {
                String signingInput = encode(MAPPER.writeValueAsBytes(header)) + "." + encode(MAPPER.writeValueAsBytes(claims));
                Signature signature = Signature.getInstance("SHA256withRSA");
                signature.initSign(key);
                signature.update(signingInput.getBytes(StandardCharsets.US_ASCII));
                return signingInput + "." + encode(signature.sign());
            } catch (JsonProcessingException | GeneralSecurityException e) {
                throw new IllegalStateException(e);
            }
        }

        public Token token() {
            return Token.parse(compact());
        }

        private static String encode(byte[] bytes) {
            return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        }
    }
}
