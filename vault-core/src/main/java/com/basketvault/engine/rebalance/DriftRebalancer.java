package com.basketvault.engine.rebalance;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;
import com.basketvault.engine.price.NormalizedPrice;
import com.basketvault.engine.price.SwapMath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Measures weight drift and plans swaps that move the basket back to target.
 *
 * Side-effect free: the same input always yields the same report and plan, which
 * is what lets the confidential path be checked against this one.
 */
@Slf4j
public class DriftRebalancer {

    /**
     * Per-asset drift against target weights.
     *
     * An empty pool (total value 0) reports every weight and drift as 0 and never
     * asks for a rebalance. An asset is flagged when its drift is strictly beyond
     * {@code thresholdPercent} points.
     */
    public DriftReport evaluateDrift(RebalanceInput input, int thresholdPercent) {
        if (thresholdPercent < 0 || thresholdPercent > 100) {
            throw new IllegalArgumentException("thresholdPercent must be 0-100, got " + thresholdPercent);
        }
        List<AssetPosition> assets = input.assets();
        long[] currentUsd = new long[assets.size()];
        long total = 0L;
        for (int i = 0; i < assets.size(); i++) {
            AssetPosition asset = assets.get(i);
            currentUsd[i] = price(asset).tokensToUsd(asset.balance(), asset.decimals());
            total = FixedPoint.add(total, currentUsd[i]);
        }

        List<DriftEntry> entries = new ArrayList<>(assets.size());
        if (total == 0) {
            for (AssetPosition asset : assets) {
                entries.add(new DriftEntry(asset.assetId(), 0L, 0L, 0, asset.targetWeight(), 0, false));
            }
            log.debug("Empty pool, no drift to evaluate");
            return new DriftReport(entries, 0L, false);
        }

        boolean needsRebalance = false;
        for (int i = 0; i < assets.size(); i++) {
            AssetPosition asset = assets.get(i);
            long targetUsd = FixedPoint.mulDiv(total, asset.targetWeight(), 100L);
            int currentWeight = (int) FixedPoint.mulDiv(currentUsd[i], 100L, total);
            int drift = currentWeight - asset.targetWeight();
            boolean exceeds = Math.abs(drift) > thresholdPercent;
            needsRebalance |= exceeds;

            entries.add(new DriftEntry(asset.assetId(), currentUsd[i], targetUsd,
                    currentWeight, asset.targetWeight(), drift, exceeds));
            log.debug("  {} target={}% current={}% drift={}{}", asset.assetId(), asset.targetWeight(),
                    currentWeight, drift, exceeds ? " (exceeds threshold)" : "");
        }
        return new DriftReport(entries, total, needsRebalance);
    }

    /**
     * Greedy drift matching.
     *
     * Each excess asset, in input order, is matched against deficit assets in input
     * order; every pair swaps min(remaining excess, remaining deficit) USD. Pairs at or
     * below the policy's minimum swap value are skipped. Planning stops when either side
     * is exhausted or {@code maxSwaps} instructions exist. Returns an empty plan when the
     * report does not call for a rebalance.
     */
    public SwapPlan planRebalance(DriftReport report, RebalanceInput input, RebalancePolicy policy) {
        if (!report.needsRebalance()) {
            return SwapPlan.empty();
        }
        List<DriftEntry> entries = report.entries();
        List<AssetPosition> assets = input.assets();
        if (entries.size() != assets.size()) {
            throw new IllegalArgumentException("drift report does not match rebalance input");
        }

        long[] remaining = new long[entries.size()];
        for (int i = 0; i < entries.size(); i++) {
            DriftEntry entry = entries.get(i);
            remaining[i] = Math.abs(FixedPoint.subtract(entry.currentUsdMicro(), entry.targetUsdMicro()));
        }

        List<SwapInstruction> swaps = new ArrayList<>();
        outer:
        for (int from = 0; from < entries.size(); from++) {
            if (!entries.get(from).isExcess()) {
                continue;
            }
            for (int to = 0; to < entries.size(); to++) {
                if (remaining[from] == 0) {
                    break;
                }
                if (to == from || !entries.get(to).isDeficit() || remaining[to] == 0) {
                    continue;
                }
                long swapUsd = Math.min(remaining[from], remaining[to]);
                if (swapUsd <= policy.minSwapUsdMicro()) {
                    continue;
                }

                AssetPosition fromAsset = assets.get(from);
                AssetPosition toAsset = assets.get(to);
                NormalizedPrice fromPrice = price(fromAsset);
                NormalizedPrice toPrice = price(toAsset);
                long amountIn = fromPrice.usdToTokens(swapUsd, fromAsset.decimals());
                long expectedOut = SwapMath.quote(amountIn, fromPrice, toPrice,
                        fromAsset.decimals(), toAsset.decimals());
                if (amountIn == 0 || expectedOut == 0) {
                    continue;
                }

                swaps.add(new SwapInstruction(fromAsset.assetId(), toAsset.assetId(), amountIn,
                        SwapMath.minimumOutput(expectedOut, policy.slippageBps())));
                remaining[from] -= swapUsd;
                remaining[to] -= swapUsd;
                log.debug("  swap ${} micro: {} {} -> {} (expected {})",
                        swapUsd, amountIn, fromAsset.assetId(), toAsset.assetId(), expectedOut);

                if (swaps.size() >= policy.maxSwaps()) {
                    break outer;
                }
            }
        }
        return new SwapPlan(swaps);
    }

    /**
     * Evaluate against the policy's threshold and plan in one step.
     */
    public RebalanceOutcome rebalance(RebalanceInput input, RebalancePolicy policy) {
        DriftReport report = evaluateDrift(input, policy.thresholdPercent());
        return new RebalanceOutcome(report, planRebalance(report, input, policy));
    }

    private static NormalizedPrice price(AssetPosition asset) {
        if (asset.priceUsdMicro() <= 0) {
            throw new VaultException(VaultErrorCode.INVALID_PRICE,
                    asset.assetId() + " price " + asset.priceUsdMicro());
        }
        return NormalizedPrice.ofUsdMicro(asset.priceUsdMicro());
    }
}
