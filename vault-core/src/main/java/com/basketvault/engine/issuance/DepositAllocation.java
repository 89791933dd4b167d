package com.basketvault.engine.issuance;

import com.basketvault.engine.model.AssetRole;

/**
 * One asset's slice of a deposit.
 */
public record DepositAllocation(
        String assetId,
        AssetRole role,
        long baseAmount,          // Portion of the deposit, in base asset units
        long usdMicro,            // Portion of the deposit value
        long expectedAssetAmount, // What baseAmount buys at current prices
        long minAssetAmount,      // expectedAssetAmount less slippage tolerance
        boolean requiresSwap      // False when the asset is the base asset itself
) {

    public boolean routesToStrategy() {
        return role == AssetRole.STRATEGY;
    }
}
