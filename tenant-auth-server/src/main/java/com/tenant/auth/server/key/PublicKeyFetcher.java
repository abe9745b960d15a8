package com.tenant.auth.server.key;

/**
 * Downloads the currently published verification keys.
 * Implementations must bound their own I/O and throw
 * {@link com.tenant.auth.server.exception.AuthServiceException} on failure.
 */
@FunctionalInterface
public interface PublicKeyFetcher {

    PublicKeySet fetch();
}
