package com.basketvault.engine.model;

import com.basketvault.engine.math.FixedPoint;

/**
 * One asset of a vault basket.
 */
public record AssetAllocation(
        String assetId,        // Asset identifier (mint / symbol)
        int weightPercent,     // Target weight, all weights of a vault sum to 100
        int decimals,          // Native decimals of the asset, 0-18
        String balanceHandle,  // Key of the asset's balance in the BalanceStore
        AssetRole role
) {

    public AssetAllocation {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("assetId must not be blank");
        }
        if (decimals < 0 || decimals > FixedPoint.MAX_DECIMALS) {
            throw new IllegalArgumentException("decimals must be 0-18 for " + assetId + ", got " + decimals);
        }
        if (balanceHandle == null || balanceHandle.isBlank()) {
            balanceHandle = assetId;
        }
        if (role == null) {
            role = AssetRole.SWAP;
        }
    }

    public static AssetAllocation swap(String assetId, int weightPercent, int decimals) {
        return new AssetAllocation(assetId, weightPercent, decimals, assetId, AssetRole.SWAP);
    }

    public static AssetAllocation strategy(String assetId, int weightPercent, int decimals) {
        return new AssetAllocation(assetId, weightPercent, decimals, assetId, AssetRole.STRATEGY);
    }

    public boolean isStrategyAsset() {
        return role == AssetRole.STRATEGY;
    }
}
