package com.basketvault.vault.confidential;

import com.basketvault.engine.rebalance.RebalanceInput;
import com.basketvault.engine.rebalance.RebalancePolicy;

/**
 * Plaintext of the payload handed, encrypted, to the confidential computation.
 */
public record ConfidentialRebalanceRequest(
        RebalanceInput input,
        RebalancePolicy policy
) {
}
