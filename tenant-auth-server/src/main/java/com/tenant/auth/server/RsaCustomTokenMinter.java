package com.tenant.auth.server;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

import com.tenant.auth.server.exception.InvalidArgumentException;
import com.tenant.auth.server.key.SigningKey;
import com.tenant.auth.server.key.SigningKeySource;
import com.tenant.auth.server.token.ClaimNames;
import com.tenant.auth.server.token.Token;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import lombok.AllArgsConstructor;
import lombok.NonNull;

/**
 * RS256 implementation using JJWT.
 */
@AllArgsConstructor
public final class RsaCustomTokenMinter implements CustomTokenMinter {

    static final int MAX_UID_LENGTH = 128;

    private final SigningKeySource keySource;
    @NonNull
    private final String issuer;
    @NonNull
    private final String audience;
    private final Duration ttl;
    private final String tenantId;
    private final Clock clock;

    public RsaCustomTokenMinter(SigningKeySource keySource, TokenAuthConfig config, Clock clock) {
        this(keySource, config.getCustomTokenIssuer(), config.getCustomTokenAudience(),
            config.getCustomTokenTtl(), config.getTenantId(), clock);
    }

    @Override
    public Token mint(String uid, Map<String, ?> claims) {
        if (uid == null || uid.isEmpty()) {
            throw new InvalidArgumentException("The uid must not be empty");
        }
        if (uid.length() > MAX_UID_LENGTH) {
            throw new InvalidArgumentException("The uid must not be longer than " + MAX_UID_LENGTH + " characters");
        }
        Map<String, ?> custom = claims == null ? Map.of() : claims;
        for (String name : custom.keySet()) {
            if (name == null || ClaimNames.RESERVED.contains(name)) {
                throw new InvalidArgumentException("Custom claim \"" + name + "\" is reserved");
            }
        }

        SigningKey key = keySource.currentSigningKey();
        Instant now = clock.instant();

        JwtBuilder builder = Jwts.builder()
            .header().keyId(key.keyId()).and()
            .issuer(issuer)
            .subject(uid)
            .audience().add(audience).and()
            .id(UUID.randomUUID().toString())
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(ttl)))
            .claim(ClaimNames.UID, uid);
        if (tenantId != null) {
            builder.claim(ClaimNames.TENANT_ID, tenantId);
        }
        custom.forEach(builder::claim);

        return Token.parse(builder.signWith(key.privateKey(), Jwts.SIG.RS256).compact());
    }
}
