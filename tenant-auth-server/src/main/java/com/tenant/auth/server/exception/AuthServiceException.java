package com.tenant.auth.server.exception;

import lombok.Getter;

/**
 * The auth backend failed or answered with something unusable.
 * {@link #getHttpStatus()} is {@code -1} when no HTTP response was involved.
 */
@Getter
public class AuthServiceException extends AuthException {

    private final int httpStatus;

    public AuthServiceException(String message) {
        this(AuthErrorCode.AUTH_SERVICE_ERROR, -1, message, null);
    }

    public AuthServiceException(String message, Throwable cause) {
        this(AuthErrorCode.AUTH_SERVICE_ERROR, -1, message, cause);
    }

    public AuthServiceException(int httpStatus, String message) {
        this(AuthErrorCode.AUTH_SERVICE_ERROR, httpStatus, message, null);
    }

    protected AuthServiceException(AuthErrorCode errorCode, int httpStatus, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.httpStatus = httpStatus;
    }
}
