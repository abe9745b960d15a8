package com.tenant.auth.server.exception;

import lombok.Getter;

@Getter
public class UserNotFoundException extends AuthException {

    private final String uid;

    public UserNotFoundException(String uid) {
        super(AuthErrorCode.USER_NOT_FOUND, "No user with uid \"" + uid + "\" found.");
        this.uid = uid;
    }
}
