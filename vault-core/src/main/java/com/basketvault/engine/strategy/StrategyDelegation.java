package com.basketvault.engine.strategy;

import com.basketvault.engine.math.FixedPoint;

/**
 * Principal delegated to, and value held by, a yield strategy on behalf of exactly one vault.
 *
 * Immutable; the ledger returns a new instance for every change so a failed
 * collaborator call leaves the previous instance untouched.
 */
public record StrategyDelegation(
        String strategyId,
        String vaultName,     // The only vault allowed to move this delegation
        long principal,       // Cumulative principal still delegated
        long currentValue     // Value of the position as last observed
) {

    public StrategyDelegation {
        if (strategyId == null || strategyId.isBlank()) {
            throw new IllegalArgumentException("strategyId must not be blank");
        }
        if (vaultName == null || vaultName.isBlank()) {
            throw new IllegalArgumentException("vaultName must not be blank");
        }
        if (principal < 0 || currentValue < 0) {
            throw new IllegalArgumentException("principal and value must not be negative");
        }
    }

    public static StrategyDelegation open(String strategyId, String vaultName) {
        return new StrategyDelegation(strategyId, vaultName, 0L, 0L);
    }

    public StrategyDelegation withObservedValue(long observedValue) {
        return new StrategyDelegation(strategyId, vaultName, principal, observedValue);
    }

    public StrategyDelegation withPrincipal(long newPrincipal, long observedValue) {
        return new StrategyDelegation(strategyId, vaultName, newPrincipal, observedValue);
    }

    /**
     * Value above principal; negative when the position is under water.
     */
    public long unrealizedYield() {
        return FixedPoint.subtract(currentValue, principal);
    }

    public boolean isBoundTo(String vault) {
        return vaultName.equals(vault);
    }
}
