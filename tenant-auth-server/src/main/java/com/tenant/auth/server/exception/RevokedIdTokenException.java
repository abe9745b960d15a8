package com.tenant.auth.server.exception;

public class RevokedIdTokenException extends RevokedTokenException {

    public RevokedIdTokenException(String uid, String tokenId) {
        super(AuthErrorCode.REVOKED_ID_TOKEN, uid, tokenId);
    }
}
