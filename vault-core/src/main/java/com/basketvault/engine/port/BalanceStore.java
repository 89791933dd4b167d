package com.basketvault.engine.port;

/**
 * Read-only view of the vault's asset balances, in native minor units.
 */
public interface BalanceStore {

    long getBalance(String balanceHandle);
}
