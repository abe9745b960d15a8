package com.tenant.auth.server.exception;

import com.tenant.auth.server.token.TokenFailure;

public class InvalidSignatureException extends InvalidTokenException {

    public InvalidSignatureException(String tokenId, String message) {
        super(AuthErrorCode.INVALID_SIGNATURE, TokenFailure.INVALID_SIGNATURE, null, tokenId, message);
    }
}
