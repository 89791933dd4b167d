package com.basketvault.engine.price;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NormalizedPriceTest {

    @Test
    void shouldDivideDownHighPrecisionQuotes() {
        // BTC $50,000 with 8 decimals
        NormalizedPrice price = NormalizedPrice.normalize(5_000_000_000_000L, -8);

        assertThat(price.usdMicro()).isEqualTo(50_000_000_000L);
        assertThat(price.rawPrice()).isEqualTo(5_000_000_000_000L);
        assertThat(price.rawExponent()).isEqualTo(-8);
    }

    @Test
    void shouldMultiplyUpLowPrecisionQuotes() {
        // ETH $2,000.00 with 2 decimals
        assertThat(NormalizedPrice.normalize(200_000L, -2).usdMicro()).isEqualTo(2_000_000_000L);
        assertThat(NormalizedPrice.normalize(3L, 0).usdMicro()).isEqualTo(3_000_000L);
    }

    @Test
    void shouldPassThroughMicroUsdQuotes() {
        assertThat(NormalizedPrice.ofUsdMicro(1_000_000L).usdMicro()).isEqualTo(1_000_000L);
    }

    @Test
    void shouldRejectNonPositivePrices() {
        assertCode(() -> NormalizedPrice.normalize(0L, -8), VaultErrorCode.INVALID_PRICE);
        assertCode(() -> NormalizedPrice.normalize(-5L, -8), VaultErrorCode.INVALID_PRICE);
    }

    @Test
    void shouldRejectPriceThatTruncatesToZero() {
        assertCode(() -> NormalizedPrice.normalize(999_999L, -12), VaultErrorCode.INVALID_PRICE);
    }

    @Test
    void shouldFailOnExponentOverflow() {
        assertCode(() -> NormalizedPrice.normalize(1L, 13), VaultErrorCode.MATH_OVERFLOW);
        assertCode(() -> NormalizedPrice.normalize(Long.MAX_VALUE, 0), VaultErrorCode.MATH_OVERFLOW);
    }

    @Test
    void shouldConvertBetweenUsdAndTokens() {
        NormalizedPrice btc = NormalizedPrice.normalize(5_000_000_000_000L, -8);

        // $1,000 buys 0.02 BTC
        assertThat(btc.usdToTokens(1_000_000_000L, 8)).isEqualTo(2_000_000L);
        // 1 BTC is worth $50,000
        assertThat(btc.tokensToUsd(100_000_000L, 8)).isEqualTo(50_000_000_000L);
        assertThat(btc.tokensToUsd(0L, 8)).isZero();
    }

    @Test
    void shouldLoseAtMostOneNativeUnitOfValueOnRoundTrip() {
        NormalizedPrice eth = NormalizedPrice.ofUsdMicro(2_000_000_000L);
        long usd = 123_456_789L;

        for (int decimals = 0; decimals <= FixedPoint.MAX_DECIMALS; decimals++) {
            long tokens = eth.usdToTokens(usd, decimals);
            long back = eth.tokensToUsd(tokens, decimals);

            assertThat(usd - back)
                    .as("decimals=%d", decimals)
                    .isBetween(0L, eth.usdMicro() / FixedPoint.pow10(decimals) + 1);
        }
    }

    @Test
    void shouldRejectNegativeAmounts() {
        NormalizedPrice usdc = NormalizedPrice.ofUsdMicro(1_000_000L);

        assertCode(() -> usdc.usdToTokens(-1L, 6), VaultErrorCode.INVALID_AMOUNT);
        assertCode(() -> usdc.tokensToUsd(-1L, 6), VaultErrorCode.INVALID_AMOUNT);
    }

    private static void assertCode(Runnable operation, VaultErrorCode code) {
        assertThatThrownBy(operation::run)
                .isInstanceOf(VaultException.class)
                .extracting(e -> ((VaultException) e).getCode())
                .isEqualTo(code);
    }
}
