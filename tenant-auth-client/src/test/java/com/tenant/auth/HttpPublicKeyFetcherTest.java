package com.tenant.auth;

import static com.tenant.auth.HttpFixtures.CLOCK;
import static com.tenant.auth.HttpFixtures.NOW;
import static com.tenant.auth.HttpFixtures.certificatePem;
import static com.tenant.auth.HttpFixtures.response;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenant.auth.server.exception.AuthServiceException;
import com.tenant.auth.server.key.PemKeyLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("HttpPublicKeyFetcher")
class HttpPublicKeyFetcherTest {

    @Mock
    private HttpClient http;

    private HttpPublicKeyFetcher fetcher;
    private String keysJson;

    @BeforeEach
    void setUp() throws Exception {
        fetcher = new HttpPublicKeyFetcher(URI.create("https://keys.example.com/id"), http, Duration.ofSeconds(5), CLOCK);
        keysJson = new ObjectMapper().writeValueAsString(Map.of("key-1", certificatePem()));
    }

    @Test
    @DisplayName("should read the certificates and expire them after max-age")
    void shouldReadCertificates() throws Exception {
        doReturn(response(200, keysJson, "Cache-Control", "public, max-age=19302, must-revalidate"))
            .when(http).send(any(), any());

        final var keys = fetcher.fetch();

        assertEquals(PemKeyLoader.loadCertificatePublicKey(certificatePem()), keys.find("key-1").orElseThrow().publicKey());
        assertEquals(NOW.plusSeconds(19302), keys.expiresAt());
    }

    @Test
    @DisplayName("should expire the set after an hour without max-age")
    void shouldDefaultToOneHour() throws Exception {
        doReturn(response(200, keysJson)).when(http).send(any(), any());

        assertEquals(NOW.plus(Duration.ofHours(1)), fetcher.fetch().expiresAt());
    }

    @Test
    @DisplayName("should send no credentials to the public key endpoint")
    void shouldSendNoCredentials() throws Exception {
        doReturn(response(200, keysJson)).when(http).send(any(), any());

        fetcher.fetch();

        final var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(captor.capture(), any());
        assertFalse(captor.getValue().headers().firstValue("Authorization").isPresent());
        assertTrue(captor.getValue().timeout().isPresent());
    }

    @Test
    @DisplayName("should reject an invalid certificate")
    void shouldRejectInvalidCertificate() throws Exception {
        doReturn(response(200, "{\"key-1\":\"not a certificate\"}")).when(http).send(any(), any());

        assertThrows(AuthServiceException.class, fetcher::fetch);
    }

    @Test
    @DisplayName("should reject a body that is not a key map")
    void shouldRejectInvalidBody() throws Exception {
        doReturn(response(200, "[1,2]")).when(http).send(any(), any());

        assertThrows(AuthServiceException.class, fetcher::fetch);
    }
}
