package com.tenant.auth.server;

import java.time.Duration;

import com.tenant.auth.server.exception.InvalidArgumentException;

/**
 * How long a session cookie stays valid, between 5 minutes and 2 weeks inclusive.
 */
public record SessionLifetime(Duration value) {

    public static final Duration MIN = Duration.ofMinutes(5);
    public static final Duration MAX = Duration.ofDays(14);
    public static final SessionLifetime DEFAULT = new SessionLifetime(MIN);

    public SessionLifetime {
        if (value == null || value.compareTo(MIN) < 0 || value.compareTo(MAX) > 0) {
            throw new InvalidArgumentException(
                "A session cookie's lifetime must be between 5 minutes and 2 weeks, got " + value);
        }
    }

    public static SessionLifetime of(Duration value) {
        return value == null ? DEFAULT : new SessionLifetime(value);
    }

    public long seconds() {
        return value.toSeconds();
    }
}
