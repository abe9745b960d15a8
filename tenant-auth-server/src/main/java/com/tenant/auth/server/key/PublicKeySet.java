package com.tenant.auth.server.key;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * An immutable snapshot of the published verification keys, valid until {@code expiresAt}.
 */
public record PublicKeySet(Map<String, VerificationKey> keys, Instant expiresAt) {

    public PublicKeySet {
        keys = Map.copyOf(keys);
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public static PublicKeySet of(Collection<VerificationKey> keys, Instant expiresAt) {
        return new PublicKeySet(
            keys.stream().collect(Collectors.toMap(VerificationKey::keyId, Function.identity())),
            expiresAt);
    }

    public Optional<VerificationKey> find(String keyId) {
        return Optional.ofNullable(keys.get(keyId));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public int size() {
        return keys.size();
    }
}
