package com.tenant.auth.server.token;

import java.util.Objects;

public record ClaimViolation(TokenFailure failure, String claimName, String message) {

    public ClaimViolation {
        Objects.requireNonNull(failure, "failure");
    }
}
