package com.basketvault.engine.issuance;

import java.util.List;

/**
 * Everything a withdrawal will release, computed before anything is executed.
 */
public record RedemptionQuote(
        long sharesToBurn,
        long withdrawalFraction,        // Scaled by FixedPoint.FRACTION_SCALE
        List<AssetRelease> releases,
        long assetsUsdMicro,            // Sum of release values
        long settlementFromAssets,      // assetsUsdMicro in base units
        long strategyUnwindAmount,      // Share of the delegated position to unstake
        long strategyPrincipalShare,    // Share of delegated principal being unwound
        long remainingShares
) {

    public RedemptionQuote {
        releases = List.copyOf(releases);
    }

    public boolean unwindsStrategy() {
        return strategyUnwindAmount > 0;
    }
}
