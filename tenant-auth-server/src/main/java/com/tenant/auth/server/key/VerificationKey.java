package com.tenant.auth.server.key;

import java.security.PublicKey;
import java.util.Objects;

public record VerificationKey(String keyId, PublicKey publicKey) {

    public VerificationKey {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(publicKey, "publicKey");
    }
}
