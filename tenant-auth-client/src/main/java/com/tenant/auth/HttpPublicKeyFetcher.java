package com.tenant.auth;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tenant.auth.server.exception.AuthServiceException;
import com.tenant.auth.server.key.PemKeyLoader;
import com.tenant.auth.server.key.PublicKeyFetcher;
import com.tenant.auth.server.key.PublicKeySet;
import com.tenant.auth.server.key.VerificationKey;

/**
 * Downloads the {@code kid -> PEM certificate} map of a key endpoint. The set expires after the
 * response's {@code Cache-Control: max-age}, or after an hour when the header is missing.
 */
public class HttpPublicKeyFetcher implements PublicKeyFetcher {

    static final Duration DEFAULT_MAX_AGE = Duration.ofHours(1);
    private static final Pattern MAX_AGE = Pattern.compile("max-age=(\\d+)");

    private final BackendHttp backend;
    private final URI keysUrl;
    private final Clock clock;

    public HttpPublicKeyFetcher(URI keysUrl, HttpClient http, Duration requestTimeout, Clock clock) {
        this.backend = new BackendHttp(http, null, requestTimeout);
        this.keysUrl = keysUrl;
        this.clock = clock;
    }

    @Override
    public PublicKeySet fetch() {
        HttpResponse<String> resp = backend.send(HttpRequest.newBuilder(keysUrl).GET(), "Public key download");
        Map<String, String> certificates =
            BackendHttp.read(resp.body(), new TypeReference<Map<String, String>>() {}, "Public key download");

        List<VerificationKey> keys = new ArrayList<>(certificates.size());
        for (Map.Entry<String, String> entry : certificates.entrySet()) {
            try {
                keys.add(new VerificationKey(entry.getKey(), PemKeyLoader.loadCertificatePublicKey(entry.getValue())));
            } catch (IllegalArgumentException e) {
                throw new AuthServiceException("Public key download: invalid certificate for key id " + entry.getKey(), e);
            }
        }
        Duration maxAge = resp.headers().firstValue("Cache-Control")
            .map(HttpPublicKeyFetcher::maxAge)
            .orElse(DEFAULT_MAX_AGE);
        return PublicKeySet.of(keys, clock.instant().plus(maxAge));
    }

    static Duration maxAge(String cacheControl) {
        Matcher matcher = MAX_AGE.matcher(cacheControl);
        return matcher.find() ? Duration.ofSeconds(Long.parseLong(matcher.group(1))) : DEFAULT_MAX_AGE;
    }
}
