package com.basketvault.engine.rebalance;

/**
 * A single asset-to-asset swap for the external executor.
 */
public record SwapInstruction(
        String fromAsset,
        String toAsset,
        long amountIn,
        long minAmountOut
) {
}
