package com.basketvault.vault.model;

import com.basketvault.engine.rebalance.DriftReport;
import com.basketvault.engine.rebalance.SwapPlan;

import java.util.List;

/**
 * Result of a rebalance attempt.
 */
public record RebalanceResult(
        String vaultName,
        DriftReport report,
        SwapPlan plan,
        List<Long> realizedOutputs,   // Index-aligned with plan.swaps()
        boolean confidential
) {

    public RebalanceResult {
        realizedOutputs = List.copyOf(realizedOutputs);
    }

    public boolean executed() {
        return !plan.isEmpty();
    }
}
