package com.tenant.auth.server;

import java.time.Duration;

import com.tenant.auth.server.token.ValidityPolicy;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class TokenAuthConfig {

    public static final String CUSTOM_TOKEN_AUDIENCE =
        "https://identitytoolkit.googleapis.com/google.identity.identitytoolkit.v1.IdentityToolkit";

    private String idTokenIssuer;
    private String idTokenAudience;
    private String sessionTokenIssuer;
    private String sessionTokenAudience;
    private String customTokenIssuer;
    private String customTokenAudience = CUSTOM_TOKEN_AUDIENCE;
    private String tenantId;

    private Duration customTokenTtl = Duration.ofHours(1);
    private Duration idTokenClockSkew = Duration.ofSeconds(30);
    private Duration sessionTokenClockSkew = Duration.ofSeconds(30);
    private Duration maxTokenAge;

    private Duration keyFetchTimeout = Duration.ofSeconds(10);
    private Duration minKeyRefreshInterval = Duration.ofMinutes(1);
    private Duration keyRefreshPeriod = Duration.ofHours(1);

    /**
     * Issuer and audience defaults of an Identity Toolkit project.
     */
    public static TokenAuthConfig forProject(String projectId) {
        TokenAuthConfig config = new TokenAuthConfig();
        config.setIdTokenIssuer("https://securetoken.google.com/" + projectId);
        config.setIdTokenAudience(projectId);
        config.setSessionTokenIssuer("https://session.firebase.google.com/" + projectId);
        config.setSessionTokenAudience(projectId);
        return config;
    }

    public ValidityPolicy idTokenPolicy() {
        return ValidityPolicy.of(idTokenIssuer, idTokenAudience, idTokenClockSkew)
            .withMaxAge(maxTokenAge)
            .withTenantId(tenantId);
    }

    public ValidityPolicy sessionTokenPolicy() {
        return ValidityPolicy.of(sessionTokenIssuer, sessionTokenAudience, sessionTokenClockSkew)
            .withMaxAge(maxTokenAge)
            .withTenantId(tenantId);
    }
}
