package com.tenant.auth;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.Map;

import com.tenant.auth.server.SessionExchangeEndpoint;

public class HttpSessionExchangeClient implements SessionExchangeEndpoint {

    private final BackendHttp backend;
    private final URI createUri;

    public HttpSessionExchangeClient(BackendClientConfig config, HttpClient http, BackendCredentials credentials) {
        this.backend = new BackendHttp(http, credentials, config.getRequestTimeout());
        this.createUri = URI.create(config.projectResource() + ":createSessionCookie");
    }

    @Override
    public String exchange(String idToken, long lifetimeSeconds) {
        return backend.postJson(createUri, Map.of("idToken", idToken, "validDuration", lifetimeSeconds),
            "Session cookie exchange");
    }
}
