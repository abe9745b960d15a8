package com.tenant.auth.server.exception;

public class UpstreamUnavailableException extends AuthServiceException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(AuthErrorCode.UPSTREAM_UNAVAILABLE, -1, message, cause);
    }
}
