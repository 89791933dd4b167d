package com.basketvault.engine.model;

/**
 * How an asset's share of a deposit is acquired and held.
 */
public enum AssetRole {

    /**
     * Deposits are converted into the asset through the swap executor and held in the vault.
     */
    SWAP,

    /**
     * Deposits are routed to the vault's yield strategy instead of being held directly.
     * At most one asset per vault may carry this role.
     */
    STRATEGY
}
