package com.basketvault.vault.confidential;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.port.ConfidentialComputation;
import com.basketvault.engine.port.PayloadCipher;
import com.basketvault.engine.rebalance.DriftRebalancer;
import com.basketvault.engine.rebalance.RebalanceInput;
import com.basketvault.engine.rebalance.RebalanceOutcome;
import com.basketvault.engine.rebalance.RebalancePolicy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Runs the rebalance computation through the confidential co-processor.
 *
 * The request is serialized as JSON, encrypted, computed remotely and decrypted back
 * into a {@link RebalanceOutcome}. With cross-checking on, the result must equal the
 * plaintext {@link DriftRebalancer} result for the same input.
 */
@Slf4j
public class ConfidentialRebalancer {

    private final ConfidentialComputation computation;
    private final PayloadCipher cipher;
    private final DriftRebalancer plaintext;
    private final boolean crossCheck;
    private final ObjectMapper objectMapper;

    public ConfidentialRebalancer(ConfidentialComputation computation,
                                  PayloadCipher cipher,
                                  DriftRebalancer plaintext,
                                  boolean crossCheck) {
        this.computation = computation;
        this.cipher = cipher;
        this.plaintext = plaintext;
        this.crossCheck = crossCheck;
        this.objectMapper = payloadMapper();
    }

    /**
     * Mapper used for request and result payloads on both sides of the computation.
     */
    public static ObjectMapper payloadMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public RebalanceOutcome rebalance(RebalanceInput input, RebalancePolicy policy) {
        byte[] request;
        try {
            request = objectMapper.writeValueAsBytes(new ConfidentialRebalanceRequest(input, policy));
        } catch (IOException e) {
            throw new VaultException(VaultErrorCode.CONFIDENTIAL_FAILED, "encoding rebalance input", e);
        }

        byte[] encryptedResult;
        try {
            encryptedResult = computation.computeRebalancing(cipher.encrypt(request));
        } catch (RuntimeException e) {
            log.error("Confidential rebalance computation failed: {}", e.getMessage());
            throw new VaultException(VaultErrorCode.CONFIDENTIAL_FAILED, "computation", e);
        }

        RebalanceOutcome outcome;
        try {
            outcome = objectMapper.readValue(cipher.decrypt(encryptedResult), RebalanceOutcome.class);
        } catch (IOException | RuntimeException e) {
            throw new VaultException(VaultErrorCode.CONFIDENTIAL_FAILED, "decoding rebalance result", e);
        }

        if (crossCheck) {
            RebalanceOutcome expected = plaintext.rebalance(input, policy);
            if (!expected.equals(outcome)) {
                log.error("Confidential rebalance result differs from plaintext: confidential={} plaintext={}",
                        outcome, expected);
                throw new VaultException(VaultErrorCode.CONFIDENTIAL_MISMATCH,
                        "needsRebalance=" + outcome.report().needsRebalance()
                                + " swaps=" + outcome.plan().size()
                                + " vs plaintext needsRebalance=" + expected.report().needsRebalance()
                                + " swaps=" + expected.plan().size());
            }
        }
        log.info("Confidential rebalance computed: needsRebalance={} swaps={}",
                outcome.report().needsRebalance(), outcome.plan().size());
        return outcome;
    }
}
