package com.basketvault.engine.model;

import java.util.List;

/**
 * Point-in-time valuation of a vault. Never persisted.
 */
public record ValuationSnapshot(
        List<AssetValuation> assets,
        long strategyUsdMicro,    // Value of the delegated position, 0 without a strategy
        long tvlUsdMicro,         // Sum of all asset values plus strategyUsdMicro
        long totalShares,
        long sharePriceUsdMicro
) {

    public ValuationSnapshot {
        assets = List.copyOf(assets);
    }
}
