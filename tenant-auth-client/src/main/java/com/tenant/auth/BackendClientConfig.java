package com.tenant.auth;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.tenant.auth.server.key.PemKeyLoader;
import com.tenant.auth.server.key.SigningKey;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class BackendClientConfig {

    private URI baseUrl = URI.create("https://identitytoolkit.googleapis.com");
    private String projectId;
    private String tenantId;

    private String serviceAccountEmail;
    private String serviceAccountKeyId;
    private String serviceAccountKeyPem;

    private URI tokenUrl = URI.create("https://oauth2.googleapis.com/token");
    private Set<String> scopes = new LinkedHashSet<>(List.of(
        "https://www.googleapis.com/auth/identitytoolkit",
        "https://www.googleapis.com/auth/cloud-platform"));
    private long skewSeconds = 30;

    private Duration requestTimeout = Duration.ofSeconds(10);

    private URI idTokenKeysUrl =
        URI.create("https://www.googleapis.com/robot/v1/metadata/x509/securetoken@system.gserviceaccount.com");
    private URI sessionTokenKeysUrl =
        URI.create("https://www.googleapis.com/identitytoolkit/v3/relyingparty/publicKeys");

    /**
     * The service account's private key; it signs both the access token assertions and custom tokens.
     */
    public SigningKey serviceAccountKey() {
        if (serviceAccountKeyId == null || serviceAccountKeyPem == null) {
            throw new IllegalStateException("serviceAccountKeyId and serviceAccountKeyPem must be set");
        }
        return PemKeyLoader.loadSigningKey(serviceAccountKeyId, serviceAccountKeyPem);
    }

    public String joinedScope() {
        return (scopes == null || scopes.isEmpty()) ? null : String.join(" ", scopes);
    }

    /**
     * The project (or tenant) resource the account endpoints hang off, e.g.
     * {@code https://host/v1/projects/p/tenants/t}.
     */
    public String projectResource() {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String resource = base + "/v1/projects/" + projectId;
        return (tenantId == null || tenantId.isBlank()) ? resource : resource + "/tenants/" + tenantId;
    }
}
