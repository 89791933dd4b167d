package com.basketvault.engine;

import com.basketvault.engine.model.AssetAllocation;
import com.basketvault.engine.model.VaultComposition;
import com.basketvault.engine.price.NormalizedPrice;
import com.basketvault.engine.price.OracleSource;

import java.util.List;
import java.util.Map;

/**
 * Shared baskets and prices for engine tests.
 *
 * USDC $1 (6 dec, base), BTC $50,000 (8 dec), ETH $2,000 (18 dec), SOL $100 (9 dec).
 */
public final class BasketFixtures {

    public static final long USDC_PRICE = 1_000_000L;
    public static final long BTC_PRICE = 50_000_000_000L;
    public static final long ETH_PRICE = 2_000_000_000L;
    public static final long SOL_PRICE = 100_000_000L;

    public static final long ONE_BTC = 100_000_000L;
    public static final long ONE_ETH = 1_000_000_000_000_000_000L;
    public static final long ONE_SOL = 1_000_000_000L;
    public static final long ONE_USDC = 1_000_000L;

    private BasketFixtures() {
    }

    /** BTC 40 / ETH 30 / SOL 30, settled in USDC. */
    public static VaultComposition majors() {
        return new VaultComposition("owner", "majors",
                List.of(AssetAllocation.swap("BTC", 40, 8),
                        AssetAllocation.swap("ETH", 30, 18),
                        AssetAllocation.swap("SOL", 30, 9)),
                null, null, OracleSource.MOCK, "USDC", 6);
    }

    /** Same weights with SOL delegated to a staking strategy. */
    public static VaultComposition stakedMajors() {
        return new VaultComposition("owner", "staked-majors",
                List.of(AssetAllocation.swap("BTC", 40, 8),
                        AssetAllocation.swap("ETH", 30, 18),
                        AssetAllocation.strategy("SOL", 30, 9)),
                null, "sol-staking", OracleSource.MOCK, "USDC", 6);
    }

    public static Map<String, NormalizedPrice> prices() {
        return Map.of(
                "USDC", NormalizedPrice.ofUsdMicro(USDC_PRICE),
                "BTC", NormalizedPrice.ofUsdMicro(BTC_PRICE),
                "ETH", NormalizedPrice.ofUsdMicro(ETH_PRICE),
                "SOL", NormalizedPrice.ofUsdMicro(SOL_PRICE));
    }

    /** What a first $1,000 deposit into {@link #majors()} buys: $400 BTC, $300 ETH, $300 SOL. */
    public static Map<String, Long> balancesAfterFirstDeposit() {
        return Map.of(
                "BTC", 800_000L,
                "ETH", 150_000_000_000_000_000L,
                "SOL", 3_000_000_000L);
    }
}
