package com.tenant.auth.server.token;

import lombok.Getter;

@Getter
public enum VerifierGeneration {
    CURRENT(false),
    LEGACY(true);

    private final boolean deprecated;

    VerifierGeneration(boolean deprecated) {
        this.deprecated = deprecated;
    }
}
