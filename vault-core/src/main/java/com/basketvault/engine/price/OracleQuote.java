package com.basketvault.engine.price;

import java.time.Instant;

/**
 * A raw price observation as returned by an {@link OracleProvider}.
 */
public record OracleQuote(
        String assetId,
        long rawPrice,
        int rawExponent,
        Instant observedAt
) {
}
