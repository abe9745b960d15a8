package com.tenant.auth.server.key;

import java.security.PrivateKey;
import java.util.Objects;

/**
 * The private key custom tokens are signed with.
 */
public record SigningKey(String keyId, PrivateKey privateKey) {

    public SigningKey {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(privateKey, "privateKey");
    }
}
