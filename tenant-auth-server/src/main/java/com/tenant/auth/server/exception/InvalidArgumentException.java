package com.tenant.auth.server.exception;

public class InvalidArgumentException extends AuthException {

    public InvalidArgumentException(String message) {
        super(AuthErrorCode.INVALID_ARGUMENT, message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(AuthErrorCode.INVALID_ARGUMENT, message, cause);
    }
}
