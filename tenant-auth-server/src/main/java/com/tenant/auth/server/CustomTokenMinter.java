package com.tenant.auth.server;

import java.util.Map;

import com.tenant.auth.server.token.Token;

/**
 * Mints custom tokens a client exchanges for an ID token to sign in with its own user ids.
 */
public interface CustomTokenMinter {

    /**
     * @throws com.tenant.auth.server.exception.InvalidArgumentException on an empty or overlong uid,
     *         or a custom claim that uses a reserved name
     */
    Token mint(String uid, Map<String, ?> claims);
}
