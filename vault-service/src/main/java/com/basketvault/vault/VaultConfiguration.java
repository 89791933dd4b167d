package com.basketvault.vault;

import com.basketvault.config.VaultProperties;
import com.basketvault.engine.issuance.IssuanceCalculator;
import com.basketvault.engine.issuance.RedemptionCalculator;
import com.basketvault.engine.port.BalanceStore;
import com.basketvault.engine.port.ConfidentialComputation;
import com.basketvault.engine.port.PayloadCipher;
import com.basketvault.engine.port.SwapExecutor;
import com.basketvault.engine.price.OracleProvider;
import com.basketvault.engine.rebalance.DriftRebalancer;
import com.basketvault.engine.strategy.StrategyDelegationLedger;
import com.basketvault.engine.valuation.ValuationEngine;
import com.basketvault.vault.confidential.ConfidentialRebalancer;
import com.basketvault.vault.service.VaultOperationService;
import com.basketvault.vault.service.VaultRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for the vault engine and its operations.
 *
 * The host application supplies the collaborators:
 * - OracleProvider for price quotes
 * - BalanceStore for vault-held balances
 * - SwapExecutor for swaps
 * - ConfidentialComputation and PayloadCipher when vault.confidential.enabled=true
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(VaultProperties.class)
public class VaultConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock vaultClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry vaultMeterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public ValuationEngine valuationEngine() {
        return new ValuationEngine();
    }

    @Bean
    public IssuanceCalculator issuanceCalculator(ValuationEngine valuationEngine) {
        return new IssuanceCalculator(valuationEngine);
    }

    @Bean
    public RedemptionCalculator redemptionCalculator() {
        return new RedemptionCalculator();
    }

    @Bean
    public DriftRebalancer driftRebalancer() {
        return new DriftRebalancer();
    }

    @Bean
    public StrategyDelegationLedger strategyDelegationLedger() {
        return new StrategyDelegationLedger();
    }

    @Bean
    public VaultRegistry vaultRegistry(MeterRegistry meterRegistry) {
        return new VaultRegistry(meterRegistry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "vault.confidential", name = "enabled", havingValue = "true")
    public ConfidentialRebalancer confidentialRebalancer(
            ConfidentialComputation computation,
            PayloadCipher cipher,
            DriftRebalancer driftRebalancer,
            VaultProperties properties
    ) {
        boolean crossCheck = properties.confidential().crossCheck();
        log.info("Confidential rebalancing enabled (crossCheck={})", crossCheck);
        return new ConfidentialRebalancer(computation, cipher, driftRebalancer, crossCheck);
    }

    @Bean
    public VaultOperationService vaultOperationService(
            VaultRegistry registry,
            OracleProvider oracleProvider,
            BalanceStore balanceStore,
            SwapExecutor swapExecutor,
            ValuationEngine valuationEngine,
            IssuanceCalculator issuanceCalculator,
            RedemptionCalculator redemptionCalculator,
            DriftRebalancer driftRebalancer,
            StrategyDelegationLedger ledger,
            ObjectProvider<ConfidentialRebalancer> confidentialRebalancer,
            VaultProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        log.info("Vault operations configured: maxPrice={} micro-USD, threshold={}%, slippage={}bps, maxSwaps={}",
                properties.oracle().maxPriceUsdMicro(), properties.rebalance().thresholdPercent(),
                properties.rebalance().slippageBps(), properties.rebalance().maxSwaps());
        return new VaultOperationService(
                registry,
                oracleProvider,
                balanceStore,
                swapExecutor,
                valuationEngine,
                issuanceCalculator,
                redemptionCalculator,
                driftRebalancer,
                ledger,
                confidentialRebalancer.getIfAvailable(),
                properties,
                clock,
                meterRegistry
        );
    }
}
