package com.tenant.auth.server.exception;

public class RevokedSessionTokenException extends RevokedTokenException {

    public RevokedSessionTokenException(String uid, String tokenId) {
        super(AuthErrorCode.REVOKED_SESSION_TOKEN, uid, tokenId);
    }
}
