package com.basketvault.engine.price;

import java.time.Duration;

/**
 * Oracle feeds a vault can be priced from.
 */
public enum OracleSource {

    /** Pull feeds with negative exponents, 2 minute freshness. */
    SWITCHBOARD(Duration.ofSeconds(120)),

    PYTH(Duration.ofSeconds(120)),

    /** Admin-updated prices already in micro-USD, 5 minute freshness. */
    MOCK(Duration.ofSeconds(300));

    private final Duration defaultMaxQuoteAge;

    OracleSource(Duration defaultMaxQuoteAge) {
        this.defaultMaxQuoteAge = defaultMaxQuoteAge;
    }

    public Duration getDefaultMaxQuoteAge() {
        return defaultMaxQuoteAge;
    }
}
