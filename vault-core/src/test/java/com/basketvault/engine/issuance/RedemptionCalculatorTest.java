package com.basketvault.engine.issuance;

import com.basketvault.engine.BasketFixtures;
import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedemptionCalculatorTest {

    private static final long SUPPLY = 1_000_000_000L;

    private final RedemptionCalculator calculator = new RedemptionCalculator();

    @Test
    void shouldReleaseEverythingOnFullWithdrawal() {
        // Given: a single holder owning the whole supply
        Map<String, Long> balances = BasketFixtures.balancesAfterFirstDeposit();

        // When: every share is burned
        RedemptionQuote quote = calculator.quoteRedemption(BasketFixtures.majors(), balances,
                BasketFixtures.prices(), 0L, 0L, SUPPLY, SUPPLY, SUPPLY);

        // Then: each asset's full balance is released and settles into $1,000
        assertThat(quote.withdrawalFraction()).isEqualTo(FixedPoint.FRACTION_SCALE);
        assertThat(quote.releases()).extracting(AssetRelease::amount)
                .containsExactly(800_000L, 150_000_000_000_000_000L, 3_000_000_000L);
        assertThat(quote.releases()).extracting(AssetRelease::expectedSettlement)
                .containsExactly(400_000_000L, 300_000_000L, 300_000_000L);
        assertThat(quote.assetsUsdMicro()).isEqualTo(1_000_000_000L);
        assertThat(quote.settlementFromAssets()).isEqualTo(1_000_000_000L);
        assertThat(quote.remainingShares()).isZero();
        assertThat(quote.unwindsStrategy()).isFalse();
    }

    @Test
    void shouldNeverReleaseMoreThanHeld() {
        // Given: an awkward supply so every slice truncates
        Map<String, Long> balances = Map.of("BTC", 800_001L, "ETH", 150_000_000_000_000_007L, "SOL", 3_000_000_013L);
        long supply = 3_333_333L;
        long burn = 1_111_111L;

        RedemptionQuote quote = calculator.quoteRedemption(BasketFixtures.majors(), balances,
                BasketFixtures.prices(), 0L, 0L, burn, supply, supply);

        // Then: each release is the truncated proportional slice, dust stays in the vault
        for (AssetRelease release : quote.releases()) {
            long balance = balances.get(release.assetId());
            assertThat(release.amount())
                    .isEqualTo(FixedPoint.mulDiv(balance, quote.withdrawalFraction(), FixedPoint.FRACTION_SCALE))
                    .isLessThanOrEqualTo(balance);
        }
        // Vault holds $1,000.000501 in total
        assertThat(quote.assetsUsdMicro()).isLessThanOrEqualTo(1_000_000_501L * burn / supply);
        assertThat(quote.remainingShares()).isEqualTo(supply - burn);
    }

    @Test
    void shouldUnwindProportionalStrategySlice() {
        RedemptionQuote quote = calculator.quoteRedemption(BasketFixtures.stakedMajors(),
                BasketFixtures.balancesAfterFirstDeposit(), BasketFixtures.prices(),
                1_100L, 1_000L, SUPPLY / 2, SUPPLY, SUPPLY);

        assertThat(quote.withdrawalFraction()).isEqualTo(500_000L);
        assertThat(quote.strategyUnwindAmount()).isEqualTo(550L);
        assertThat(quote.strategyPrincipalShare()).isEqualTo(500L);
        assertThat(quote.unwindsStrategy()).isTrue();
    }

    @Test
    void shouldReportSignedYield() {
        assertThat(calculator.yieldComponent(1_100L, 1_000L, FixedPoint.FRACTION_SCALE)).isEqualTo(100L);
        assertThat(calculator.yieldComponent(900L, 1_000L, FixedPoint.FRACTION_SCALE)).isEqualTo(-100L);
        assertThat(calculator.yieldComponent(450L, 1_000L, 500_000L)).isEqualTo(-50L);
    }

    @Test
    void shouldRejectInvalidBurns() {
        assertCode(() -> calculator.withdrawalFraction(0L, SUPPLY, SUPPLY), VaultErrorCode.INVALID_AMOUNT);
        assertCode(() -> calculator.withdrawalFraction(SUPPLY + 1, SUPPLY, SUPPLY + 1), VaultErrorCode.INSUFFICIENT_SHARES);
        assertCode(() -> calculator.withdrawalFraction(10L, SUPPLY, 9L), VaultErrorCode.INSUFFICIENT_SHARES);
    }

    private static void assertCode(Runnable operation, VaultErrorCode code) {
        assertThatThrownBy(operation::run)
                .isInstanceOf(VaultException.class)
                .extracting(e -> ((VaultException) e).getCode())
                .isEqualTo(code);
    }
}
