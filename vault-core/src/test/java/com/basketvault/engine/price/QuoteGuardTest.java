package com.basketvault.engine.price;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.model.AssetAllocation;
import com.basketvault.engine.model.VaultComposition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuoteGuardTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final long CEILING = 10_000_000_000_000L;

    @Mock
    private OracleProvider oracle;

    private QuoteGuard guard;

    @BeforeEach
    void setUp() {
        guard = new QuoteGuard(oracle, Duration.ofSeconds(120), CEILING, Clock.fixed(NOW, ZoneId.of("UTC")));
    }

    @Test
    void shouldNormalizeFreshQuote() {
        // Given: a BTC quote observed 119s ago
        when(oracle.getQuote("BTC")).thenReturn(new OracleQuote("BTC", 5_000_000_000_000L, -8, NOW.minusSeconds(119)));

        // When
        NormalizedPrice price = guard.price("BTC");

        // Then
        assertThat(price.usdMicro()).isEqualTo(50_000_000_000L);
    }

    @Test
    void shouldRejectQuoteAtMaxAge() {
        when(oracle.getQuote("BTC")).thenReturn(new OracleQuote("BTC", 5_000_000_000_000L, -8, NOW.minusSeconds(120)));

        assertThatThrownBy(() -> guard.price("BTC"))
                .isInstanceOf(VaultException.class)
                .satisfies(e -> {
                    VaultException ve = (VaultException) e;
                    assertThat(ve.getCode()).isEqualTo(VaultErrorCode.STALE_QUOTE);
                    assertThat(ve.isRetryable()).isTrue();
                });
    }

    @Test
    void shouldRejectQuoteStampedInTheFuture() {
        OracleQuote aheadOneSecond = new OracleQuote("BTC", 5_000_000_000_000L, -8, NOW.plusSeconds(1));
        OracleQuote aheadOneYear = new OracleQuote("BTC", 5_000_000_000_000L, -8, NOW.plus(Duration.ofDays(365)));

        assertThatThrownBy(() -> guard.verify(aheadOneSecond))
                .isInstanceOf(VaultException.class)
                .extracting(e -> ((VaultException) e).getCode())
                .isEqualTo(VaultErrorCode.STALE_QUOTE);
        assertThatThrownBy(() -> guard.verify(aheadOneYear))
                .isInstanceOf(VaultException.class)
                .extracting(e -> ((VaultException) e).getCode())
                .isEqualTo(VaultErrorCode.STALE_QUOTE);
    }

    @Test
    void shouldAcceptQuoteObservedNow() {
        assertThat(guard.verify(new OracleQuote("BTC", 5_000_000_000_000L, -8, NOW)).usdMicro())
                .isEqualTo(50_000_000_000L);
    }

    @Test
    void shouldRejectQuoteWithoutTimestamp() {
        assertThatThrownBy(() -> guard.verify(new OracleQuote("BTC", 1L, 0, null)))
                .isInstanceOf(VaultException.class)
                .extracting(e -> ((VaultException) e).getCode())
                .isEqualTo(VaultErrorCode.STALE_QUOTE);
    }

    @Test
    void shouldRejectImplausiblePrice() {
        // $20M per unit is above the $10M ceiling
        OracleQuote quote = new OracleQuote("BTC", 20_000_000_000_000L, -6, NOW);

        assertThatThrownBy(() -> guard.verify(quote))
                .isInstanceOf(VaultException.class)
                .extracting(e -> ((VaultException) e).getCode())
                .isEqualTo(VaultErrorCode.INVALID_PRICE);
    }

    @Test
    void shouldRejectMissingQuote() {
        when(oracle.getQuote("DOGE")).thenReturn(null);

        assertThatThrownBy(() -> guard.price("DOGE"))
                .isInstanceOf(VaultException.class)
                .extracting(e -> ((VaultException) e).getCode())
                .isEqualTo(VaultErrorCode.INVALID_PRICE);
    }

    @Test
    void shouldPriceAllocationsAndBaseAsset() {
        // Given: a vault settling in USDC, which is not itself a basket asset
        VaultComposition composition = new VaultComposition("owner", "majors",
                List.of(AssetAllocation.swap("BTC", 60, 8), AssetAllocation.swap("SOL", 40, 9)),
                null, null, OracleSource.MOCK, "USDC", 6);
        when(oracle.getQuote("BTC")).thenReturn(new OracleQuote("BTC", 50_000_000_000L, -6, NOW));
        when(oracle.getQuote("SOL")).thenReturn(new OracleQuote("SOL", 100_000_000L, -6, NOW));
        when(oracle.getQuote("USDC")).thenReturn(new OracleQuote("USDC", 1_000_000L, -6, NOW));

        // When
        Map<String, NormalizedPrice> prices = guard.prices(composition);

        // Then
        assertThat(prices).containsOnlyKeys("BTC", "SOL", "USDC");
        assertThat(prices.get("SOL").usdMicro()).isEqualTo(100_000_000L);
        assertThat(prices.get("USDC").usdMicro()).isEqualTo(1_000_000L);
    }
}
