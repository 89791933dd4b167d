package com.basketvault.engine.port;

/**
 * Co-processor that runs the rebalance computation on an encrypted snapshot and
 * returns the encrypted drift report and swap plan.
 */
public interface ConfidentialComputation {

    byte[] computeRebalancing(byte[] encryptedInput);
}
