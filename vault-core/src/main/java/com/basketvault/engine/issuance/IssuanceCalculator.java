package com.basketvault.engine.issuance;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;
import com.basketvault.engine.model.AssetAllocation;
import com.basketvault.engine.model.ValuationSnapshot;
import com.basketvault.engine.model.VaultComposition;
import com.basketvault.engine.price.NormalizedPrice;
import com.basketvault.engine.price.SwapMath;
import com.basketvault.engine.valuation.ValuationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes shares to mint for a deposit and how the deposit is split across the basket.
 */
@Slf4j
@RequiredArgsConstructor
public class IssuanceCalculator {

    private final ValuationEngine valuationEngine;

    /**
     * shares = deposit * 10^9 / sharePrice / 10^3, truncated.
     */
    public long sharesToMint(long depositUsdMicro, long sharePriceUsdMicro) {
        if (sharePriceUsdMicro <= 0) {
            throw new VaultException(VaultErrorCode.MATH_OVERFLOW,
                    "share price must be positive, got " + sharePriceUsdMicro);
        }
        if (depositUsdMicro <= 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT,
                    "deposit value must be positive, got " + depositUsdMicro);
        }
        long scaled = FixedPoint.mulDiv(depositUsdMicro, FixedPoint.SHARE_PRECISION, sharePriceUsdMicro);
        return FixedPoint.divide(scaled, 1_000L);
    }

    /**
     * Split a deposit in proportion to target weights.
     *
     * Each asset gets {@code depositAmount * weight / 100} base units (truncated). Assets
     * other than the base asset are priced through {@link SwapMath}; the STRATEGY asset's
     * slice is flagged for delegation rather than held.
     */
    public List<DepositAllocation> allocate(VaultComposition composition,
                                            long depositAmount,
                                            long depositUsdMicro,
                                            Map<String, NormalizedPrice> prices,
                                            int slippageBps) {
        NormalizedPrice basePrice = ValuationEngine.priceOf(prices, composition.baseAssetId());
        List<DepositAllocation> allocations = new ArrayList<>(composition.assetCount());

        for (AssetAllocation asset : composition.allocations()) {
            long baseAmount = FixedPoint.mulDiv(depositAmount, asset.weightPercent(), VaultComposition.TOTAL_WEIGHT);
            long usdMicro = FixedPoint.mulDiv(depositUsdMicro, asset.weightPercent(), VaultComposition.TOTAL_WEIGHT);
            boolean isBase = asset.assetId().equals(composition.baseAssetId());

            long expected;
            long minimum;
            if (isBase) {
                expected = baseAmount;
                minimum = baseAmount;
            } else {
                NormalizedPrice assetPrice = ValuationEngine.priceOf(prices, asset.assetId());
                expected = SwapMath.quote(baseAmount, basePrice, assetPrice,
                        composition.baseDecimals(), asset.decimals());
                minimum = SwapMath.minimumOutput(expected, slippageBps);
            }

            allocations.add(new DepositAllocation(
                    asset.assetId(),
                    asset.role(),
                    baseAmount,
                    usdMicro,
                    expected,
                    minimum,
                    !isBase && baseAmount > 0
            ));
            log.debug("  {} ({}%, {}): {} base units = {} micro-USD -> {} units",
                    asset.assetId(), asset.weightPercent(), asset.role(), baseAmount, usdMicro, expected);
        }
        return allocations;
    }

    /**
     * Quote a deposit of {@code depositAmount} base units against the pre-deposit valuation.
     */
    public DepositQuote quoteDeposit(VaultComposition composition,
                                     ValuationSnapshot current,
                                     long depositAmount,
                                     Map<String, NormalizedPrice> prices,
                                     int slippageBps) {
        if (depositAmount <= 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT, "deposit must be positive, got " + depositAmount);
        }
        NormalizedPrice basePrice = ValuationEngine.priceOf(prices, composition.baseAssetId());
        long depositUsd = basePrice.tokensToUsd(depositAmount, composition.baseDecimals());
        long sharePrice = current.sharePriceUsdMicro();
        long shares = sharesToMint(depositUsd, sharePrice);
        if (shares == 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT,
                    "deposit of " + depositUsd + " micro-USD mints no shares at price " + sharePrice);
        }

        List<DepositAllocation> allocations = allocate(composition, depositAmount, depositUsd, prices, slippageBps);
        long allocated = 0L;
        long toDelegate = 0L;
        for (DepositAllocation allocation : allocations) {
            allocated = FixedPoint.add(allocated, allocation.baseAmount());
            if (allocation.routesToStrategy()) {
                toDelegate = FixedPoint.add(toDelegate, allocation.expectedAssetAmount());
            }
        }

        long postTvl = FixedPoint.add(current.tvlUsdMicro(), depositUsd);
        long postShares = FixedPoint.add(current.totalShares(), shares);
        long postSharePrice = valuationEngine.computeSharePrice(postTvl, postShares);

        return new DepositQuote(
                depositAmount,
                depositUsd,
                sharePrice,
                shares,
                allocations,
                toDelegate,
                FixedPoint.subtract(depositAmount, allocated),
                postTvl,
                postShares,
                postSharePrice
        );
    }
}
