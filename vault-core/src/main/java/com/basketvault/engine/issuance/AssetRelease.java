package com.basketvault.engine.issuance;

/**
 * One asset's proportional slice of a redemption.
 */
public record AssetRelease(
        String assetId,
        long amount,              // Native units leaving the vault
        long usdMicro,            // Value of amount at current prices
        long expectedSettlement,  // Base units the amount converts to
        boolean requiresSwap
) {
}
