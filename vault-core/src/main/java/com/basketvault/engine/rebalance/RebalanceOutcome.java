package com.basketvault.engine.rebalance;

/**
 * Drift report and the plan derived from it.
 */
public record RebalanceOutcome(DriftReport report, SwapPlan plan) {
}
