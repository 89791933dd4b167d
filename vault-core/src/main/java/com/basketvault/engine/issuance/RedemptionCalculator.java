package com.basketvault.engine.issuance;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;
import com.basketvault.engine.model.AssetAllocation;
import com.basketvault.engine.model.VaultComposition;
import com.basketvault.engine.price.NormalizedPrice;
import com.basketvault.engine.valuation.ValuationEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes proportional redemptions: per-asset releases, strategy unwind and yield attribution.
 */
@Slf4j
public class RedemptionCalculator {

    /**
     * shares * SCALE / totalShares, after checking the burn against supply and holder balance.
     */
    public long withdrawalFraction(long sharesToBurn, long totalShares, long holderBalance) {
        if (sharesToBurn <= 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT, "shares to burn must be positive, got " + sharesToBurn);
        }
        if (sharesToBurn > totalShares) {
            throw new VaultException(VaultErrorCode.INSUFFICIENT_SHARES,
                    sharesToBurn + " exceeds outstanding supply " + totalShares);
        }
        if (sharesToBurn > holderBalance) {
            throw new VaultException(VaultErrorCode.INSUFFICIENT_SHARES,
                    sharesToBurn + " exceeds holder balance " + holderBalance);
        }
        return FixedPoint.mulDiv(sharesToBurn, FixedPoint.FRACTION_SCALE, totalShares);
    }

    /**
     * amount * fraction / SCALE, truncated.
     */
    public long proportionalAmount(long amount, long fraction) {
        return FixedPoint.mulDiv(amount, fraction, FixedPoint.FRACTION_SCALE);
    }

    /**
     * Yield realized by an unwind: what came back minus the principal share it retired.
     * Negative when the strategy lost value; never clamped.
     */
    public long yieldComponent(long receivedAmount, long delegatedPrincipal, long fraction) {
        return FixedPoint.subtract(receivedAmount, proportionalAmount(delegatedPrincipal, fraction));
    }

    /**
     * Quote a redemption of {@code sharesToBurn}.
     *
     * @param balances vault-held native balance per asset id
     * @param strategyValue current value of the delegated position (0 without a strategy)
     * @param strategyPrincipal delegated principal (0 without a strategy)
     */
    public RedemptionQuote quoteRedemption(VaultComposition composition,
                                           Map<String, Long> balances,
                                           Map<String, NormalizedPrice> prices,
                                           long strategyValue,
                                           long strategyPrincipal,
                                           long sharesToBurn,
                                           long totalShares,
                                           long holderBalance) {
        long fraction = withdrawalFraction(sharesToBurn, totalShares, holderBalance);
        NormalizedPrice basePrice = ValuationEngine.priceOf(prices, composition.baseAssetId());

        List<AssetRelease> releases = new ArrayList<>(composition.assetCount());
        long totalUsd = 0L;
        for (AssetAllocation asset : composition.allocations()) {
            long balance = ValuationEngine.balanceOf(balances, asset.assetId());
            long amount = proportionalAmount(balance, fraction);
            long usd = ValuationEngine.priceOf(prices, asset.assetId()).tokensToUsd(amount, asset.decimals());
            boolean isBase = asset.assetId().equals(composition.baseAssetId());
            long settlement = isBase ? amount : basePrice.usdToTokens(usd, composition.baseDecimals());

            releases.add(new AssetRelease(asset.assetId(), amount, usd, settlement, !isBase && amount > 0));
            totalUsd = FixedPoint.add(totalUsd, usd);
            log.debug("  release {}: {} of {} units (${} micro)", asset.assetId(), amount, balance, usd);
        }

        long unwind = proportionalAmount(strategyValue, fraction);
        long principalShare = proportionalAmount(strategyPrincipal, fraction);

        return new RedemptionQuote(
                sharesToBurn,
                fraction,
                releases,
                totalUsd,
                basePrice.usdToTokens(totalUsd, composition.baseDecimals()),
                unwind,
                principalShare,
                FixedPoint.subtract(totalShares, sharesToBurn)
        );
    }
}
