package com.basketvault.engine.strategy;

/**
 * Outcome of a partial or full unwind of a delegation.
 */
public record UnwindResult(
        StrategyDelegation delegation, // State after the unwind
        long requestedAmount,          // currentValue * fraction / SCALE
        long receivedAmount,           // What the strategy actually paid out
        long principalReduction,       // principal * fraction / SCALE
        long yieldAmount               // receivedAmount - principalReduction, may be negative
) {
}
