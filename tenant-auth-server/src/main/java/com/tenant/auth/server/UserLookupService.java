package com.tenant.auth.server;

public interface UserLookupService {

    /**
     * @throws com.tenant.auth.server.exception.UserNotFoundException if the uid does not exist
     */
    UserRevocationState getUser(String uid);
}
