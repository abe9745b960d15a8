package com.tenant.auth.server.exception;

import lombok.Getter;

@Getter
public class RevokedTokenException extends AuthException {

    private final String uid;
    private final String tokenId;

    protected RevokedTokenException(AuthErrorCode errorCode, String uid, String tokenId) {
        super(errorCode, errorCode.getDefaultMessage() + " (uid=" + uid + ", jti=" + tokenId + ")");
        this.uid = uid;
        this.tokenId = tokenId;
    }
}
