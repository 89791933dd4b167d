package com.basketvault.vault;

import com.basketvault.engine.model.AssetAllocation;
import com.basketvault.engine.model.VaultComposition;
import com.basketvault.engine.port.BalanceStore;
import com.basketvault.engine.price.OracleProvider;
import com.basketvault.engine.price.OracleQuote;
import com.basketvault.engine.price.OracleSource;
import com.basketvault.engine.strategy.YieldStrategy;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Vault compositions and in-memory collaborators for service tests.
 *
 * Prices: USDC $1 (6 dec, base), BTC $50,000 (8 dec), ETH $2,000 (18 dec), SOL $100 (9 dec).
 */
public final class VaultFixtures {

    public static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    public static final long THOUSAND_USDC = 1_000_000_000L;

    private VaultFixtures() {
    }

    /** BTC 40 / ETH 30 / SOL 30, settled in USDC. */
    public static VaultComposition majors() {
        return new VaultComposition("alice", "majors",
                List.of(AssetAllocation.swap("BTC", 40, 8),
                        AssetAllocation.swap("ETH", 30, 18),
                        AssetAllocation.swap("SOL", 30, 9)),
                null, null, OracleSource.MOCK, "USDC", 6);
    }

    /** Same weights with SOL delegated to a staking strategy. */
    public static VaultComposition stakedMajors() {
        return new VaultComposition("alice", "staked-majors",
                List.of(AssetAllocation.swap("BTC", 40, 8),
                        AssetAllocation.swap("ETH", 30, 18),
                        AssetAllocation.strategy("SOL", 30, 9)),
                null, "sol-staking", OracleSource.MOCK, "USDC", 6);
    }

    /** Micro-USD quotes for the four test assets, observed at a settable instant. */
    public static final class MockOracle implements OracleProvider {

        private final Map<String, Long> prices = new HashMap<>(Map.of(
                "USDC", 1_000_000L,
                "BTC", 50_000_000_000L,
                "ETH", 2_000_000_000L,
                "SOL", 100_000_000L));
        private Instant observedAt = NOW;

        @Override
        public OracleQuote getQuote(String assetId) {
            Long price = prices.get(assetId);
            return price == null ? null : new OracleQuote(assetId, price, -6, observedAt);
        }

        public void observedAt(Instant instant) {
            this.observedAt = instant;
        }
    }

    /** Balances keyed by balance handle; unknown handles hold nothing. */
    public static final class InMemoryBalances implements BalanceStore {

        private final Map<String, Long> balances = new HashMap<>();

        @Override
        public long getBalance(String balanceHandle) {
            return balances.getOrDefault(balanceHandle, 0L);
        }

        public void set(String balanceHandle, long amount) {
            balances.put(balanceHandle, amount);
        }

        /** What a first $1,000 deposit into a 40/30/30 basket holds: $400 BTC, $300 ETH, $300 SOL. */
        public void setBalanced() {
            set("BTC", 800_000L);
            set("ETH", 150_000_000_000_000_000L);
            set("SOL", 3_000_000_000L);
        }

        /** $600 BTC, $200 ETH, $200 SOL. */
        public void setOverweightBtc() {
            set("BTC", 1_200_000L);
            set("ETH", 100_000_000_000_000_000L);
            set("SOL", 2_000_000_000L);
        }
    }

    /** Strategy whose position value can be moved by the test to simulate yield or loss. */
    public static final class FakeStrategy implements YieldStrategy {

        private long value;
        private long staked;

        @Override
        public void stake(long amount) {
            value += amount;
            staked += amount;
        }

        @Override
        public long unstake(long amount) {
            value -= amount;
            return amount;
        }

        @Override
        public long currentValue() {
            return value;
        }

        public void setValue(long value) {
            this.value = value;
        }

        public long staked() {
            return staked;
        }
    }
}
