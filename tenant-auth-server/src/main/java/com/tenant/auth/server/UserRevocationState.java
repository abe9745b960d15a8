package com.tenant.auth.server;

import java.time.Instant;

/**
 * @param tokensValidAfterTime tokens authenticated before this instant are revoked;
 *                             {@code null} if the user's tokens were never revoked
 */
public record UserRevocationState(String uid, Instant tokensValidAfterTime) {}
