package com.tenant.auth.server;

import java.time.Instant;

import com.tenant.auth.server.exception.InvalidTokenException;
import com.tenant.auth.server.token.ClaimNames;
import com.tenant.auth.server.token.Token;
import com.tenant.auth.server.token.TokenFailure;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Compares a token's {@code auth_time} with the user's valid-since time. Looks the user up on
 * every call; revocations must be seen immediately, so nothing is cached.
 */
@Slf4j
@AllArgsConstructor
public class RevocationChecker {

    private final UserLookupService users;

    public boolean isRevoked(Token token) {
        String uid = token.subject();
        if (uid == null || uid.isEmpty()) {
            throw new InvalidTokenException(TokenFailure.INVALID_SUBJECT, ClaimNames.SUBJECT, token.tokenId(),
                "The token has no subject");
        }
        Instant authTime = token.instantClaim(ClaimNames.AUTH_TIME)
            .orElseThrow(() -> new InvalidTokenException(TokenFailure.MALFORMED, ClaimNames.AUTH_TIME,
                token.tokenId(), "The token has no auth_time claim"));

        Instant validSince = users.getUser(uid).tokensValidAfterTime();
        boolean revoked = validSince != null && authTime.isBefore(validSince);
        if (revoked) {
            log.debug("Token of uid={} authenticated at {} is revoked, valid since {}", uid, authTime, validSince);
        }
        return revoked;
    }
}
