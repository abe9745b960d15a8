package com.tenant.auth.server;

public interface RefreshTokenRevoker {

    /**
     * Revokes the user's refresh tokens and marks every token authenticated before now as revoked.
     */
    void revokeRefreshTokens(String uid);
}
