package com.tenant.auth.server;

/**
 * The backend call that trades an ID token for a session cookie.
 */
public interface SessionExchangeEndpoint {

    /**
     * @return the raw response body of a successful (2xx) exchange
     * @throws com.tenant.auth.server.exception.AuthServiceException on a non-2xx response
     * @throws com.tenant.auth.server.exception.UpstreamUnavailableException on timeout
     */
    String exchange(String idToken, long lifetimeSeconds);
}
