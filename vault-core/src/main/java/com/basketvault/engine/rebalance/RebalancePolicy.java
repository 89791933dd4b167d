package com.basketvault.engine.rebalance;

/**
 * Policy knobs of the rebalancer.
 */
public record RebalancePolicy(
        int thresholdPercent,   // Drift beyond this many points triggers a rebalance
        int slippageBps,        // min_amount_out = expected * (1 - slippage)
        int maxSwaps,           // Upper bound on plan size
        long minSwapUsdMicro    // Pairs worth this much or less are not swapped
) {

    public static final int DEFAULT_THRESHOLD_PERCENT = 5;
    public static final int DEFAULT_SLIPPAGE_BPS = 100;
    public static final int DEFAULT_MAX_SWAPS = 6;
    public static final long DEFAULT_MIN_SWAP_USD_MICRO = 1_000_000L;

    public RebalancePolicy {
        if (thresholdPercent < 0 || thresholdPercent > 100) {
            throw new IllegalArgumentException("thresholdPercent must be 0-100, got " + thresholdPercent);
        }
        if (slippageBps < 0 || slippageBps >= 10_000) {
            throw new IllegalArgumentException("slippageBps must be 0-9999, got " + slippageBps);
        }
        if (maxSwaps < 1) {
            throw new IllegalArgumentException("maxSwaps must be at least 1, got " + maxSwaps);
        }
        if (minSwapUsdMicro < 0) {
            throw new IllegalArgumentException("minSwapUsdMicro must not be negative");
        }
    }

    public static RebalancePolicy defaults() {
        return new RebalancePolicy(
                DEFAULT_THRESHOLD_PERCENT,
                DEFAULT_SLIPPAGE_BPS,
                DEFAULT_MAX_SWAPS,
                DEFAULT_MIN_SWAP_USD_MICRO
        );
    }
}
