package com.basketvault.engine.port;

/**
 * Encryption shared between the vault and the {@link ConfidentialComputation}.
 */
public interface PayloadCipher {

    byte[] encrypt(byte[] plaintext);

    byte[] decrypt(byte[] ciphertext);
}
