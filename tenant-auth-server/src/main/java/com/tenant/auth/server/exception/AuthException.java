package com.tenant.auth.server.exception;

import lombok.Getter;

/**
 * Base of every failure surfaced by the token engine.
 */
@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorCode errorCode;

    public AuthException(AuthErrorCode errorCode, String message) {
        super(message == null ? errorCode.getDefaultMessage() : message);
        this.errorCode = errorCode;
    }

    public AuthException(AuthErrorCode errorCode, String message, Throwable cause) {
        super(message == null ? errorCode.getDefaultMessage() : message, cause);
        this.errorCode = errorCode;
    }
}
