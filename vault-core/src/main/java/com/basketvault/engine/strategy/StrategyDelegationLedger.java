package com.basketvault.engine.strategy;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks principal and observed value of a vault's delegated yield position.
 *
 * Every method validates and computes the new state before calling the strategy;
 * a strategy failure surfaces as STRATEGY_FAILED and the caller keeps the
 * delegation it passed in.
 */
@Slf4j
public class StrategyDelegationLedger {

    /**
     * Stake {@code amount} and record the post-stake value reported by the strategy.
     */
    public StrategyDelegation delegate(StrategyDelegation delegation, String vaultName,
                                       YieldStrategy strategy, long amount) {
        checkBinding(delegation, vaultName);
        if (amount <= 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT, "delegation must be positive, got " + amount);
        }
        long newPrincipal = FixedPoint.add(delegation.principal(), amount);

        try {
            strategy.stake(amount);
        } catch (VaultException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Stake of {} into {} failed for vault {}: {}",
                    amount, delegation.strategyId(), vaultName, e.getMessage());
            throw new VaultException(VaultErrorCode.STRATEGY_FAILED, "stake of " + amount, e);
        }

        long observed = observe(strategy, delegation);
        log.info("Delegated {} to {} for vault {}: principal={} value={}",
                amount, delegation.strategyId(), vaultName, newPrincipal, observed);
        return delegation.withPrincipal(newPrincipal, observed);
    }

    /**
     * Unwind {@code fraction / SCALE} of the position.
     *
     * Requests {@code currentValue * fraction / SCALE} from the strategy and retires
     * {@code principal * fraction / SCALE} of principal. Whatever value remains above
     * the reduced principal stays as unrealized yield for the remaining holders.
     */
    public UnwindResult undelegate(StrategyDelegation delegation, String vaultName,
                                   YieldStrategy strategy, long fraction) {
        checkBinding(delegation, vaultName);
        if (fraction <= 0 || fraction > FixedPoint.FRACTION_SCALE) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT,
                    "fraction must be in (0, " + FixedPoint.FRACTION_SCALE + "], got " + fraction);
        }
        long requested = FixedPoint.mulDiv(delegation.currentValue(), fraction, FixedPoint.FRACTION_SCALE);
        long principalReduction = FixedPoint.mulDiv(delegation.principal(), fraction, FixedPoint.FRACTION_SCALE);
        long newPrincipal = FixedPoint.subtract(delegation.principal(), principalReduction);

        long received = 0L;
        if (requested > 0) {
            try {
                received = strategy.unstake(requested);
            } catch (VaultException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Unstake of {} from {} failed for vault {}: {}",
                        requested, delegation.strategyId(), vaultName, e.getMessage());
                throw new VaultException(VaultErrorCode.STRATEGY_FAILED, "unstake of " + requested, e);
            }
            if (received < 0) {
                throw new VaultException(VaultErrorCode.STRATEGY_FAILED, "strategy reported negative payout " + received);
            }
        }

        long observed = observe(strategy, delegation);
        long yieldAmount = FixedPoint.subtract(received, principalReduction);
        StrategyDelegation updated = delegation.withPrincipal(newPrincipal, observed);
        log.info("Undelegated {} from {} for vault {}: received={} principalRetired={} yield={} residual={}",
                requested, delegation.strategyId(), vaultName, received, principalReduction,
                yieldAmount, updated.unrealizedYield());
        return new UnwindResult(updated, requested, received, principalReduction, yieldAmount);
    }

    /**
     * Re-read the position's value without changing principal.
     */
    public StrategyDelegation refresh(StrategyDelegation delegation, YieldStrategy strategy) {
        return delegation.withObservedValue(observe(strategy, delegation));
    }

    private long observe(YieldStrategy strategy, StrategyDelegation delegation) {
        long value;
        try {
            value = strategy.currentValue();
        } catch (RuntimeException e) {
            throw new VaultException(VaultErrorCode.STRATEGY_FAILED,
                    "reading value of " + delegation.strategyId(), e);
        }
        if (value < 0) {
            throw new VaultException(VaultErrorCode.STRATEGY_FAILED,
                    delegation.strategyId() + " reported negative value " + value);
        }
        return value;
    }

    private static void checkBinding(StrategyDelegation delegation, String vaultName) {
        if (!delegation.isBoundTo(vaultName)) {
            throw new VaultException(VaultErrorCode.UNAUTHORIZED,
                    delegation.strategyId() + " belongs to " + delegation.vaultName() + ", not " + vaultName);
        }
    }
}
