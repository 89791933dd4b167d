package com.basketvault.vault.model;

import com.basketvault.engine.issuance.DepositQuote;

/**
 * Result of a settled deposit.
 */
public record DepositReceipt(
        String vaultName,
        String holder,
        DepositQuote quote,
        long delegatedAmount,
        long holderShares
) {

    public long sharesMinted() {
        return quote.sharesToMint();
    }
}
