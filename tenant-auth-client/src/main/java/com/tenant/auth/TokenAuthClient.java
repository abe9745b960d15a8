package com.tenant.auth;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

import com.tenant.auth.server.TokenAuthConfig;
import com.tenant.auth.server.TokenAuthService;
import com.tenant.auth.server.key.CachingSigningKeySource;
import com.tenant.auth.server.key.SigningKey;
import com.tenant.auth.server.key.SigningKeyRefresher;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link TokenAuthService} wired against the HTTP backend under a service account, with the
 * background refreshers for the public keys. Close it to stop them.
 */
@Slf4j
public final class TokenAuthClient implements AutoCloseable {

    private final TokenAuthService service;
    private final SigningKeyRefresher idKeysRefresher;
    private final SigningKeyRefresher sessionKeysRefresher;

    private TokenAuthClient(TokenAuthService service, SigningKeyRefresher idKeysRefresher,
                            SigningKeyRefresher sessionKeysRefresher) {
        this.service = service;
        this.idKeysRefresher = idKeysRefresher;
        this.sessionKeysRefresher = sessionKeysRefresher;
    }

    /**
     * The service account key signs custom tokens, and its email is their issuer unless
     * {@code authConfig} names another one.
     */
    public static TokenAuthClient create(TokenAuthConfig authConfig, BackendClientConfig backendConfig,
                                         HttpClient http, Clock clock) {
        SigningKey serviceAccountKey = backendConfig.serviceAccountKey();
        if (authConfig.getCustomTokenIssuer() == null) {
            authConfig.setCustomTokenIssuer(backendConfig.getServiceAccountEmail());
        }
        var credentials = new BackendCredentials(
            new ServiceAccountTokenClient(http, backendConfig, serviceAccountKey, clock),
            Duration.ofSeconds(backendConfig.getSkewSeconds()));

        var idTokenKeys = keySource(serviceAccountKey, backendConfig.getIdTokenKeysUrl(), authConfig, backendConfig,
            http, clock);
        var sessionTokenKeys = keySource(null, backendConfig.getSessionTokenKeysUrl(), authConfig, backendConfig, http,
            clock);
        var users = new HttpUserAccountClient(backendConfig, http, credentials, clock);
        var sessionExchange = new HttpSessionExchangeClient(backendConfig, http, credentials);

        var service = TokenAuthService.create(authConfig, idTokenKeys, sessionTokenKeys, users, sessionExchange, clock);
        log.info("Token auth client started for project {}{} as {}", backendConfig.getProjectId(),
            backendConfig.getTenantId() == null ? "" : " tenant " + backendConfig.getTenantId(),
            backendConfig.getServiceAccountEmail());
        return new TokenAuthClient(service,
            new SigningKeyRefresher(idTokenKeys, authConfig.getKeyRefreshPeriod()),
            new SigningKeyRefresher(sessionTokenKeys, authConfig.getKeyRefreshPeriod()));
    }

    private static CachingSigningKeySource keySource(SigningKey signingKey, URI keysUrl,
                                                     TokenAuthConfig authConfig, BackendClientConfig backendConfig,
                                                     HttpClient http, Clock clock) {
        var fetcher = new HttpPublicKeyFetcher(keysUrl, http, backendConfig.getRequestTimeout(), clock);
        return new CachingSigningKeySource(signingKey, fetcher, clock,
            authConfig.getKeyFetchTimeout(), authConfig.getMinKeyRefreshInterval());
    }

    public TokenAuthService service() {
        return service;
    }

    @Override
    public void close() {
        idKeysRefresher.close();
        sessionKeysRefresher.close();
    }
}
