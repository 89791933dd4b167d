package com.basketvault.engine.error;

/**
 * Failure categories raised by the vault engine.
 *
 * Every code is local and synchronous. The engine never retries; {@link #isRetryable()}
 * only tells the calling service whether refreshing its inputs (e.g. re-reading an
 * oracle quote) can make the same operation succeed.
 */
public enum VaultErrorCode {

    // ============== ARITHMETIC ==============

    MATH_OVERFLOW("Math overflow occurred", false),

    // ============== ORACLE INPUT ==============

    INVALID_PRICE("Invalid price", true),
    STALE_QUOTE("Stale quote", true),

    // ============== CALLER PRECONDITIONS ==============

    INVALID_AMOUNT("Invalid amount: must be greater than 0", false),
    INSUFFICIENT_SHARES("Insufficient shares for withdrawal", false),
    INSUFFICIENT_BALANCE("Insufficient balance", false),
    INVALID_TVL("TVL is not positive while shares are outstanding", false),
    ASSET_NOT_FOUND("Asset not found in vault composition", false),
    UNAUTHORIZED("Strategy delegation is bound to another vault", false),

    // ============== COMPOSITION ==============

    INVALID_WEIGHTS("Asset weights must be positive and sum to 100", false),
    INVALID_ASSET_COUNT("Asset count must be 1-10", false),
    INVALID_NAME("Vault name must be 1-32 characters", false),

    // ============== REGISTRY ==============

    VAULT_NOT_FOUND("Vault not registered", false),
    VAULT_ALREADY_EXISTS("Vault already registered", false),

    // ============== COLLABORATORS ==============

    SWAP_FAILED("Swap execution failed", false),
    STRATEGY_FAILED("Yield strategy call failed", false),
    CONFIDENTIAL_FAILED("Confidential computation failed", false),
    CONFIDENTIAL_MISMATCH("Confidential computation disagrees with plaintext computation", false);

    private final String description;
    private final boolean retryable;

    VaultErrorCode(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    /**
     * True when the caller may retry after refreshing oracle input.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
