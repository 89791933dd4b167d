package com.basketvault.engine.rebalance;

import java.util.List;

/**
 * Per-asset drift and the resulting rebalance decision. Consumed immediately, never persisted.
 */
public record DriftReport(
        List<DriftEntry> entries,
        long totalUsdMicro,
        boolean needsRebalance
) {

    public DriftReport {
        entries = List.copyOf(entries);
    }

    public boolean isEmptyPool() {
        return totalUsdMicro == 0;
    }
}
