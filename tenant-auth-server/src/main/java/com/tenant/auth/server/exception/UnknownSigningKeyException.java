package com.tenant.auth.server.exception;

import com.tenant.auth.server.token.TokenFailure;
import lombok.Getter;

@Getter
public class UnknownSigningKeyException extends InvalidTokenException {

    private final String keyId;

    public UnknownSigningKeyException(String keyId, String tokenId) {
        super(AuthErrorCode.UNKNOWN_KEY, TokenFailure.UNKNOWN_KEY, null, tokenId,
            "No public key found for key id \"" + keyId + "\"");
        this.keyId = keyId;
    }
}
