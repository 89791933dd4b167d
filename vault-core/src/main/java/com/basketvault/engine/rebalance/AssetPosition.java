package com.basketvault.engine.rebalance;

/**
 * Plaintext rebalance input for one asset.
 */
public record AssetPosition(
        String assetId,
        long balance,
        long priceUsdMicro,
        int targetWeight,
        int decimals
) {
}
