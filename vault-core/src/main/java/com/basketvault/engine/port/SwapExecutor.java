package com.basketvault.engine.port;

import com.basketvault.engine.rebalance.SwapInstruction;

/**
 * Executes a swap through an external aggregator.
 */
public interface SwapExecutor {

    /**
     * Execute one swap and return the realized output amount. Implementations throw
     * when the swap fails or cannot meet {@link SwapInstruction#minAmountOut()}.
     */
    long execute(SwapInstruction instruction);
}
