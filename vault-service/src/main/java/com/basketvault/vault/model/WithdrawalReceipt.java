package com.basketvault.vault.model;

import com.basketvault.engine.issuance.RedemptionQuote;

/**
 * Result of a settled withdrawal. Amounts are in base asset units unless noted.
 */
public record WithdrawalReceipt(
        String vaultName,
        String holder,
        RedemptionQuote quote,
        long settledFromAssets,   // Realized swap output plus base asset released directly
        long strategyReceived,    // Paid out by the yield strategy, strategy asset units
        long yieldAmount,         // strategyReceived minus retired principal, may be negative
        long holderShares
) {

    public long sharesBurned() {
        return quote.sharesToBurn();
    }
}
