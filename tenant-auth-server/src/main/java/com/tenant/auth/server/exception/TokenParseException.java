package com.tenant.auth.server.exception;

public class TokenParseException extends AuthException {

    public TokenParseException(String message) {
        super(AuthErrorCode.TOKEN_PARSE_ERROR, message);
    }

    public TokenParseException(String message, Throwable cause) {
        super(AuthErrorCode.TOKEN_PARSE_ERROR, message, cause);
    }
}
