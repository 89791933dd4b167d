package com.basketvault.engine.model;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;
import com.basketvault.engine.price.OracleSource;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The basket definition of one vault instance.
 *
 * Validated on construction, before any state exists:
 * - name is 1-32 characters (INVALID_NAME)
 * - 1 to 10 assets (INVALID_ASSET_COUNT)
 * - every weight is positive, asset ids are unique, weights sum to exactly 100 (INVALID_WEIGHTS)
 * - at most one STRATEGY asset, and only with a strategy reference (INVALID_WEIGHTS)
 */
public record VaultComposition(
        String owner,
        String name,
        List<AssetAllocation> allocations,
        String shareUnitId,
        String strategyId,       // Optional yield strategy delegation, null when absent
        OracleSource oracleSource,
        String baseAssetId,      // Currency deposits arrive in and withdrawals settle in
        int baseDecimals
) {

    public static final int MAX_NAME_LENGTH = 32;
    public static final int MAX_ASSETS = 10;
    public static final int TOTAL_WEIGHT = 100;

    public VaultComposition {
        if (name == null || name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            throw new VaultException(VaultErrorCode.INVALID_NAME, "'" + name + "'");
        }
        if (allocations == null || allocations.isEmpty() || allocations.size() > MAX_ASSETS) {
            throw new VaultException(VaultErrorCode.INVALID_ASSET_COUNT,
                    "got " + (allocations == null ? 0 : allocations.size()));
        }

        int totalWeight = 0;
        int strategyAssets = 0;
        Set<String> seen = new HashSet<>();
        for (AssetAllocation allocation : allocations) {
            if (allocation.weightPercent() <= 0) {
                throw new VaultException(VaultErrorCode.INVALID_WEIGHTS,
                        allocation.assetId() + " has weight " + allocation.weightPercent());
            }
            if (!seen.add(allocation.assetId())) {
                throw new VaultException(VaultErrorCode.INVALID_WEIGHTS,
                        "duplicate asset " + allocation.assetId());
            }
            totalWeight += allocation.weightPercent();
            if (allocation.isStrategyAsset()) {
                strategyAssets++;
            }
        }
        if (totalWeight != TOTAL_WEIGHT) {
            throw new VaultException(VaultErrorCode.INVALID_WEIGHTS, "weights sum to " + totalWeight);
        }
        if (strategyAssets > 1) {
            throw new VaultException(VaultErrorCode.INVALID_WEIGHTS, "more than one strategy asset");
        }
        if (strategyAssets == 1 && (strategyId == null || strategyId.isBlank())) {
            throw new VaultException(VaultErrorCode.INVALID_WEIGHTS, "strategy asset without a strategy delegation");
        }

        if (baseAssetId == null || baseAssetId.isBlank()) {
            throw new IllegalArgumentException("baseAssetId must not be blank");
        }
        if (baseDecimals < 0 || baseDecimals > FixedPoint.MAX_DECIMALS) {
            throw new IllegalArgumentException("base decimals must be 0-18 for " + baseAssetId + ", got " + baseDecimals);
        }
        for (AssetAllocation allocation : allocations) {
            if (allocation.assetId().equals(baseAssetId) && allocation.decimals() != baseDecimals) {
                throw new IllegalArgumentException("base asset decimals disagree with its allocation");
            }
        }

        allocations = List.copyOf(allocations);
        if (oracleSource == null) {
            oracleSource = OracleSource.SWITCHBOARD;
        }
        if (shareUnitId == null || shareUnitId.isBlank()) {
            shareUnitId = name + "-shares";
        }
        if (strategyId != null && strategyId.isBlank()) {
            strategyId = null;
        }
    }

    /**
     * Look up an allocation by asset identity.
     */
    public AssetAllocation allocation(String assetId) {
        return allocations.stream()
                .filter(a -> a.assetId().equals(assetId))
                .findFirst()
                .orElseThrow(() -> new VaultException(VaultErrorCode.ASSET_NOT_FOUND, assetId + " in vault " + name));
    }

    public Optional<AssetAllocation> strategyAllocation() {
        return allocations.stream().filter(AssetAllocation::isStrategyAsset).findFirst();
    }

    public boolean hasStrategy() {
        return strategyId != null;
    }

    public int assetCount() {
        return allocations.size();
    }
}
