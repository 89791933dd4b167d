package com.basketvault.engine.rebalance;

/**
 * Drift of one asset against its target weight.
 */
public record DriftEntry(
        String assetId,
        long currentUsdMicro,
        long targetUsdMicro,
        int currentWeight,       // Integer percent, truncated
        int targetWeight,
        int drift,               // currentWeight - targetWeight
        boolean exceedsThreshold // |drift| > threshold, strictly
) {

    public boolean isExcess() {
        return currentUsdMicro > targetUsdMicro;
    }

    public boolean isDeficit() {
        return currentUsdMicro < targetUsdMicro;
    }
}
