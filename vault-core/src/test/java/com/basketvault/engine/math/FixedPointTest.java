package com.basketvault.engine.math;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixedPointTest {

    @Test
    void shouldCarryWideProductThroughMulDiv() {
        // 1e18 * 5e10 does not fit in 64 bits, the quotient does
        long result = FixedPoint.mulDiv(1_000_000_000_000_000_000L, 50_000_000_000L, 1_000_000_000_000_000_000L);

        assertThat(result).isEqualTo(50_000_000_000L);
    }

    @Test
    void shouldTruncateTowardZero() {
        assertThat(FixedPoint.mulDiv(7, 1, 2)).isEqualTo(3);
        assertThat(FixedPoint.mulDiv(-7, 1, 2)).isEqualTo(-3);
        assertThat(FixedPoint.divide(-7, 2)).isEqualTo(-3);
    }

    @Test
    void shouldFailOnOverflowInsteadOfWrapping() {
        assertOverflow(() -> FixedPoint.add(Long.MAX_VALUE, 1));
        assertOverflow(() -> FixedPoint.subtract(Long.MIN_VALUE, 1));
        assertOverflow(() -> FixedPoint.multiply(Long.MAX_VALUE / 2, 3));
        assertOverflow(() -> FixedPoint.mulDiv(Long.MAX_VALUE, 4, 2));
        assertOverflow(() -> FixedPoint.toLong(BigInteger.ONE.shiftLeft(63)));
    }

    @Test
    void shouldRejectDivisionByZero() {
        assertOverflow(() -> FixedPoint.divide(1, 0));
        assertOverflow(() -> FixedPoint.mulDiv(1, 1, 0));
        assertOverflow(() -> FixedPoint.divide(Long.MIN_VALUE, -1));
    }

    @Test
    void shouldBoundPowersOfTen() {
        assertThat(FixedPoint.pow10(0)).isEqualTo(1L);
        assertThat(FixedPoint.pow10(18)).isEqualTo(1_000_000_000_000_000_000L);
        assertOverflow(() -> FixedPoint.pow10(19));
        assertOverflow(() -> FixedPoint.pow10(-1));
    }

    private static void assertOverflow(Runnable operation) {
        assertThatThrownBy(operation::run)
                .isInstanceOf(VaultException.class)
                .extracting(e -> ((VaultException) e).getCode())
                .isEqualTo(VaultErrorCode.MATH_OVERFLOW);
    }
}
