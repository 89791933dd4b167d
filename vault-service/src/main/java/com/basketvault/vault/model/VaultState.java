package com.basketvault.vault.model;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;
import com.basketvault.engine.strategy.StrategyDelegation;

import java.util.HashMap;
import java.util.Map;

/**
 * Share supply, holder balances and strategy delegation of one vault.
 *
 * Immutable: operations build the next state and the registry swaps it in only
 * once the whole operation has succeeded.
 */
public record VaultState(
        long totalShares,
        Map<String, Long> holderShares,
        StrategyDelegation delegation   // null without a strategy
) {

    public VaultState {
        holderShares = Map.copyOf(holderShares);
    }

    public static VaultState initial(StrategyDelegation delegation) {
        return new VaultState(0L, Map.of(), delegation);
    }

    public long sharesOf(String holder) {
        return holderShares.getOrDefault(holder, 0L);
    }

    public VaultState withMinted(String holder, long shares) {
        Map<String, Long> next = new HashMap<>(holderShares);
        next.put(holder, FixedPoint.add(sharesOf(holder), shares));
        return new VaultState(FixedPoint.add(totalShares, shares), next, delegation);
    }

    public VaultState withBurned(String holder, long shares) {
        long held = sharesOf(holder);
        if (shares > held || shares > totalShares) {
            throw new VaultException(VaultErrorCode.INSUFFICIENT_SHARES, holder + " holds " + held);
        }
        Map<String, Long> next = new HashMap<>(holderShares);
        if (held == shares) {
            next.remove(holder);
        } else {
            next.put(holder, held - shares);
        }
        return new VaultState(totalShares - shares, next, delegation);
    }

    public VaultState withDelegation(StrategyDelegation updated) {
        return new VaultState(totalShares, holderShares, updated);
    }
}
