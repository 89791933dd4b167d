package com.basketvault.engine.strategy;

/**
 * External yield-bearing strategy (e.g. a liquid staking protocol). Amounts are in
 * native units of the vault's strategy asset.
 */
public interface YieldStrategy {

    /**
     * Deposit principal into the strategy.
     */
    void stake(long amount);

    /**
     * Unwind {@code amount} of the position and return what was actually received,
     * including any accrued yield.
     */
    long unstake(long amount);

    /**
     * Current value of the whole delegated position.
     */
    long currentValue();
}
