package com.tenant.auth.server.token;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenant.auth.server.exception.InvalidTokenException;
import com.tenant.auth.server.exception.TokenParseException;

/**
 * A compact signed token (header, claims, signature), decoded but not verified.
 * <p>
 * Instances are immutable and keep the exact string they were parsed from, so
 * {@link #compact()} always re-emits the original bytes.
 */
public final class Token {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    // NumericDates are limited to years 0000-9999 so skew and max-age arithmetic cannot overflow
    private static final BigDecimal MAX_NUMERIC_DATE = BigDecimal.valueOf(253_402_300_799L);
    private static final BigDecimal MIN_NUMERIC_DATE = BigDecimal.valueOf(-62_167_219_200L);

    private final String compact;
    private final Map<String, Object> header;
    private final Map<String, Object> claims;
    private final String signature;

    private Token(String compact, Map<String, Object> header, Map<String, Object> claims, String signature) {
        this.compact = compact;
        this.header = Collections.unmodifiableMap(header);
        this.claims = Collections.unmodifiableMap(claims);
        this.signature = signature;
    }

    public static Token parse(String compact) {
        if (compact == null || compact.isBlank()) {
            throw new TokenParseException("The token string is empty");
        }
        String[] segments = compact.split("\\.", -1);
        if (segments.length != 3) {
            throw new TokenParseException("Expected 3 token segments, got " + segments.length);
        }
        Map<String, Object> header = decodeSegment(segments[0], "header");
        Map<String, Object> claims = decodeSegment(segments[1], "claims");
        return new Token(compact, header, claims, segments[2]);
    }

    private static Map<String, Object> decodeSegment(String segment, String name) {
        try {
            byte[] json = Base64.getUrlDecoder().decode(segment.getBytes(StandardCharsets.US_ASCII));
            Map<String, Object> decoded = MAPPER.readValue(json, JSON_OBJECT);
            if (decoded == null) {
                throw new TokenParseException("The token " + name + " is not a JSON object");
            }
            return decoded;
        } catch (IllegalArgumentException e) {
            throw new TokenParseException("The token " + name + " is not valid Base64URL", e);
        } catch (IOException e) {
            throw new TokenParseException("The token " + name + " is not a JSON object", e);
        }
    }

    public String compact() {
        return compact;
    }

    public Map<String, Object> header() {
        return header;
    }

    public Map<String, Object> claims() {
        return claims;
    }

    public String signature() {
        return signature;
    }

    public String algorithm() {
        Object alg = header.get("alg");
        return alg instanceof String s ? s : null;
    }

    public Optional<String> keyId() {
        Object kid = header.get("kid");
        return kid instanceof String s && !s.isBlank() ? Optional.of(s) : Optional.empty();
    }

    public Object claim(String name) {
        return claims.get(name);
    }

    public Optional<String> stringClaim(String name) {
        Object value = claims.get(name);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /**
     * Reads a NumericDate claim (seconds since the epoch).
     *
     * @throws InvalidTokenException ({@link TokenFailure#MALFORMED}) if the value is not a representable date
     */
    public Optional<Instant> instantClaim(String name) {
        Object value = claims.get(name);
        if (!(value instanceof Number n)) {
            return Optional.empty();
        }
        BigDecimal seconds;
        try {
            seconds = new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            throw outOfRange(name, n);
        }
        if (seconds.compareTo(MIN_NUMERIC_DATE) < 0 || seconds.compareTo(MAX_NUMERIC_DATE) > 0) {
            throw outOfRange(name, n);
        }
        return Optional.of(Instant.ofEpochSecond(seconds.longValue()));
    }

    private InvalidTokenException outOfRange(String name, Number value) {
        return new InvalidTokenException(TokenFailure.MALFORMED, name, tokenId(),
            "The " + name + " claim is not a valid date: " + value);
    }

    /**
     * The {@code aud} claim, which may be serialized either as a single string or as an array.
     */
    public List<String> audience() {
        Object aud = claims.get(ClaimNames.AUDIENCE);
        if (aud instanceof String s) {
            return List.of(s);
        }
        if (aud instanceof List<?> list) {
            return list.stream()
                .filter(String.class::isInstance)
                .map(String.class::cast)
                .toList();
        }
        return List.of();
    }

    public String subject() {
        return stringClaim(ClaimNames.SUBJECT).orElse(null);
    }

    public String tokenId() {
        return stringClaim(ClaimNames.TOKEN_ID).orElse(null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return compact.equals(other.compact);
    }

    @Override
    public int hashCode() {
        return Objects.hash(compact);
    }

    @Override
    public String toString() {
        return compact;
    }
}
