package com.tenant.auth.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenant.auth.server.exception.AuthServiceException;
import com.tenant.auth.server.exception.TokenParseException;
import com.tenant.auth.server.token.Token;
import lombok.extern.slf4j.Slf4j;

/**
 * Exchanges an ID token for a session cookie. The cookie is returned exactly as the backend
 * sent it and is not verified here.
 */
@Slf4j
public class SessionCookieMinter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SessionExchangeEndpoint endpoint;

    public SessionCookieMinter(SessionExchangeEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    public Token mintSession(Token idToken, SessionLifetime lifetime) {
        SessionLifetime effective = lifetime == null ? SessionLifetime.DEFAULT : lifetime;
        String body = endpoint.exchange(idToken.compact(), effective.seconds());
        if (body == null || body.isBlank()) {
            throw new AuthServiceException("The session cookie response is empty");
        }

        JsonNode response;
        try {
            response = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AuthServiceException(
                "Unable to parse the session cookie response as JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode cookie = response.get("sessionCookie");
        if (cookie == null || !cookie.isTextual() || cookie.asText().isEmpty()) {
            throw new AuthServiceException("The session cookie response does not include a 'sessionCookie' field, got: "
                + response.toPrettyString());
        }

        try {
            Token session = Token.parse(cookie.asText());
            log.debug("Minted session cookie for uid={} valid for {}s", idToken.subject(), effective.seconds());
            return session;
        } catch (TokenParseException e) {
            throw new TokenParseException("Unable to parse the session cookie into a token: " + e.getMessage(), e);
        }
    }
}
