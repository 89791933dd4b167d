package com.basketvault.vault.service;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.model.VaultComposition;
import com.basketvault.engine.strategy.StrategyDelegation;
import com.basketvault.engine.strategy.YieldStrategy;
import com.basketvault.vault.model.VaultState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Registry of vault instances.
 *
 * Each vault is guarded by its own lock so state-changing operations on one vault
 * are serialized, while different vaults proceed independently.
 */
@Slf4j
public class VaultRegistry {

    private final Map<String, VaultHandle> vaults = new ConcurrentHashMap<>();

    public VaultRegistry(MeterRegistry meterRegistry) {
        Gauge.builder("vault.registered", vaults, Map::size)
                .description("Number of registered vaults")
                .register(meterRegistry);
    }

    /**
     * Register a new vault. A vault with a strategy reference must come with its strategy.
     */
    public VaultHandle register(VaultComposition composition, YieldStrategy strategy) {
        if (composition.hasStrategy() && strategy == null) {
            throw new IllegalArgumentException("vault " + composition.name() + " references strategy "
                    + composition.strategyId() + " but none was supplied");
        }
        StrategyDelegation delegation = composition.hasStrategy()
                ? StrategyDelegation.open(composition.strategyId(), composition.name())
                : null;
        VaultHandle handle = new VaultHandle(composition, composition.hasStrategy() ? strategy : null,
                VaultState.initial(delegation));

        if (vaults.putIfAbsent(composition.name(), handle) != null) {
            throw new VaultException(VaultErrorCode.VAULT_ALREADY_EXISTS, composition.name());
        }
        log.info("Registered vault {} owned by {}: {} assets, strategy={}, oracle={}",
                composition.name(), composition.owner(), composition.assetCount(),
                composition.strategyId(), composition.oracleSource());
        return handle;
    }

    public Optional<VaultHandle> find(String vaultName) {
        return Optional.ofNullable(vaults.get(vaultName));
    }

    public VaultHandle get(String vaultName) {
        return find(vaultName).orElseThrow(() -> new VaultException(VaultErrorCode.VAULT_NOT_FOUND, vaultName));
    }

    public Collection<VaultHandle> getAll() {
        return Collections.unmodifiableCollection(vaults.values());
    }

    /**
     * Run {@code operation} with exclusive access to one vault.
     */
    public <T> T execute(String vaultName, Function<VaultHandle, T> operation) {
        VaultHandle handle = get(vaultName);
        handle.lock.lock();
        try {
            return operation.apply(handle);
        } finally {
            handle.lock.unlock();
        }
    }

    public boolean deregister(String vaultName) {
        VaultHandle removed = vaults.remove(vaultName);
        if (removed != null) {
            log.info("Deregistered vault: {}", vaultName);
        }
        return removed != null;
    }

    /**
     * A registered vault: immutable composition, its strategy collaborator and the current state.
     */
    public static final class VaultHandle {

        private final VaultComposition composition;
        private final YieldStrategy strategy;
        private final ReentrantLock lock = new ReentrantLock();
        private volatile VaultState state;

        VaultHandle(VaultComposition composition, YieldStrategy strategy, VaultState state) {
            this.composition = composition;
            this.strategy = strategy;
            this.state = state;
        }

        public VaultComposition composition() {
            return composition;
        }

        public Optional<YieldStrategy> strategy() {
            return Optional.ofNullable(strategy);
        }

        public VaultState state() {
            return state;
        }

        /**
         * Replace the state; only valid while holding the vault's lock.
         */
        void commit(VaultState next) {
            if (!lock.isHeldByCurrentThread()) {
                throw new IllegalStateException("commit outside of exclusive vault access: " + composition.name());
            }
            this.state = next;
        }
    }
}
