package com.tenant.auth.server.key;

import java.util.Optional;

/**
 * Supplies the private key for minting and the public keys for verification.
 */
public interface SigningKeySource {

    /**
     * @throws IllegalStateException if this source was built for verification only
     */
    SigningKey currentSigningKey();

    /**
     * Looks up a verification key, refreshing the cached set once if the id is unknown.
     *
     * @return empty if the id is still unknown after the refresh
     */
    Optional<VerificationKey> findVerificationKey(String keyId);

    void refresh();
}
