package com.basketvault.engine.valuation;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;
import com.basketvault.engine.model.AssetAllocation;
import com.basketvault.engine.model.AssetValuation;
import com.basketvault.engine.model.ValuationSnapshot;
import com.basketvault.engine.model.VaultComposition;
import com.basketvault.engine.price.NormalizedPrice;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes asset values, total value locked and share price.
 *
 * Stateless; every method is a pure function of its arguments.
 */
@Slf4j
public class ValuationEngine {

    /** Share price of an empty vault: $1.00. */
    public static final long BOOTSTRAP_SHARE_PRICE = 1_000_000L;

    /**
     * TVL in micro-USD: sum of every asset's value plus the delegated strategy value.
     *
     * @param balances native balances, index-aligned with prices and decimals
     * @param strategyUsdMicro value of the delegated position in micro-USD (0 without a strategy)
     */
    public long computeTvl(long[] balances, NormalizedPrice[] prices, int[] decimals, long strategyUsdMicro) {
        if (balances.length != prices.length || balances.length != decimals.length) {
            throw new IllegalArgumentException("balances, prices and decimals must have the same length");
        }
        long tvl = strategyUsdMicro;
        for (int i = 0; i < balances.length; i++) {
            tvl = FixedPoint.add(tvl, prices[i].tokensToUsd(balances[i], decimals[i]));
        }
        return tvl;
    }

    /**
     * Share price in micro-USD per share unit.
     *
     * Returns {@value #BOOTSTRAP_SHARE_PRICE} when no shares exist, otherwise
     * {@code tvl * 10^9 / totalShares / 10^3}, truncating at each step so that
     * rounding dust stays with the remaining holders.
     *
     * @throws VaultException INVALID_TVL when shares exist but TVL is not positive
     */
    public long computeSharePrice(long tvlUsdMicro, long totalShares) {
        if (totalShares < 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT, "negative share supply " + totalShares);
        }
        if (totalShares == 0) {
            return BOOTSTRAP_SHARE_PRICE;
        }
        if (tvlUsdMicro <= 0) {
            log.error("TVL is {} while {} shares are outstanding", tvlUsdMicro, totalShares);
            throw new VaultException(VaultErrorCode.INVALID_TVL,
                    "TVL " + tvlUsdMicro + " with " + totalShares + " shares outstanding");
        }
        long scaled = FixedPoint.mulDiv(tvlUsdMicro, FixedPoint.SHARE_PRECISION, totalShares);
        return FixedPoint.divide(scaled, 1_000L);
    }

    /**
     * Full valuation of a vault.
     *
     * @param balances native balance per asset id (vault-held, excluding the strategy position)
     * @param prices normalized price per asset id
     * @param strategyValue current value of the delegated position in native units of the strategy asset
     */
    public ValuationSnapshot snapshot(VaultComposition composition,
                                      Map<String, Long> balances,
                                      Map<String, NormalizedPrice> prices,
                                      long strategyValue,
                                      long totalShares) {
        List<AssetValuation> assets = new ArrayList<>(composition.assetCount());
        long tvl = 0L;
        for (AssetAllocation allocation : composition.allocations()) {
            long balance = balanceOf(balances, allocation.assetId());
            long usd = priceOf(prices, allocation.assetId()).tokensToUsd(balance, allocation.decimals());
            assets.add(new AssetValuation(allocation.assetId(), balance, usd));
            tvl = FixedPoint.add(tvl, usd);
        }

        long strategyUsd = strategyUsdMicro(composition, prices, strategyValue);
        tvl = FixedPoint.add(tvl, strategyUsd);

        long sharePrice = computeSharePrice(tvl, totalShares);
        log.debug("Valued vault {}: assets={} strategyUsd={} tvl={} shares={} sharePrice={}",
                composition.name(), assets, strategyUsd, tvl, totalShares, sharePrice);
        return new ValuationSnapshot(assets, strategyUsd, tvl, totalShares, sharePrice);
    }

    /**
     * Micro-USD value of the delegated position, priced as the vault's strategy asset.
     */
    public long strategyUsdMicro(VaultComposition composition, Map<String, NormalizedPrice> prices, long strategyValue) {
        if (strategyValue == 0) {
            return 0L;
        }
        AssetAllocation strategyAsset = composition.strategyAllocation()
                .orElseThrow(() -> new VaultException(VaultErrorCode.ASSET_NOT_FOUND,
                        "vault " + composition.name() + " has strategy value but no strategy asset"));
        return priceOf(prices, strategyAsset.assetId()).tokensToUsd(strategyValue, strategyAsset.decimals());
    }

    public static long balanceOf(Map<String, Long> balances, String assetId) {
        Long balance = balances.get(assetId);
        if (balance == null) {
            return 0L;
        }
        if (balance < 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT, "negative balance for " + assetId);
        }
        return balance;
    }

    public static NormalizedPrice priceOf(Map<String, NormalizedPrice> prices, String assetId) {
        NormalizedPrice price = prices.get(assetId);
        if (price == null) {
            throw new VaultException(VaultErrorCode.INVALID_PRICE, "missing price for " + assetId);
        }
        return price;
    }
}
