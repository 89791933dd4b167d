package com.basketvault.engine.rebalance;

import com.basketvault.engine.model.AssetAllocation;
import com.basketvault.engine.model.VaultComposition;
import com.basketvault.engine.price.NormalizedPrice;
import com.basketvault.engine.valuation.ValuationEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Snapshot the rebalancer works on. The same value is handed, encrypted, to the
 * confidential computation, so both paths see identical inputs.
 */
public record RebalanceInput(
        List<AssetPosition> assets
) {

    public RebalanceInput {
        assets = List.copyOf(assets);
    }

    /**
     * Build from a composition, balances and prices, in composition order.
     */
    public static RebalanceInput of(VaultComposition composition,
                                    Map<String, Long> balances,
                                    Map<String, NormalizedPrice> prices) {
        List<AssetPosition> positions = new ArrayList<>(composition.assetCount());
        for (AssetAllocation asset : composition.allocations()) {
            positions.add(new AssetPosition(
                    asset.assetId(),
                    ValuationEngine.balanceOf(balances, asset.assetId()),
                    ValuationEngine.priceOf(prices, asset.assetId()).usdMicro(),
                    asset.weightPercent(),
                    asset.decimals()
            ));
        }
        return new RebalanceInput(positions);
    }
}
