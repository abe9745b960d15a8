package com.tenant.auth.server.token;

import java.util.Set;

public final class ClaimNames {
    public static final String ISSUER = "iss";
    public static final String AUDIENCE = "aud";
    public static final String SUBJECT = "sub";
    public static final String ISSUED_AT = "iat";
    public static final String EXPIRES_AT = "exp";
    public static final String NOT_BEFORE = "nbf";
    public static final String TOKEN_ID = "jti";
    public static final String AUTH_TIME = "auth_time";
    public static final String UID = "uid";
    public static final String TENANT_ID = "tenant_id";

    /**
     * Claims a custom token's caller may not set, because the minter or the backend owns them.
     */
    public static final Set<String> RESERVED = Set.of(
        ISSUER, AUDIENCE, SUBJECT, ISSUED_AT, EXPIRES_AT, NOT_BEFORE, TOKEN_ID, AUTH_TIME, UID, TENANT_ID);

    private ClaimNames() {}
}
