package com.basketvault.engine.math;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;

import java.math.BigInteger;

/**
 * Checked integer arithmetic for micro-USD and native token amounts.
 *
 * All operations fail with {@link VaultErrorCode#MATH_OVERFLOW} instead of wrapping,
 * and division always truncates toward zero. Products that may exceed 64 bits before
 * a division ({@link #mulDiv}) are carried in a wide intermediate and only the final
 * quotient has to fit.
 */
public final class FixedPoint {

    /** Micro-USD scale (6 decimals). */
    public static final long USD_SCALE = 1_000_000L;

    /** Share unit precision multiplier used by share price and issuance. */
    public static final long SHARE_PRECISION = 1_000_000_000L;

    /** Precision of withdrawal and unwind fractions. */
    public static final long FRACTION_SCALE = 1_000_000L;

    public static final int MAX_DECIMALS = 18;

    private static final long[] POW10 = new long[MAX_DECIMALS + 1];

    static {
        long value = 1L;
        for (int i = 0; i <= MAX_DECIMALS; i++) {
            POW10[i] = value;
            value *= 10L;
        }
    }

    private FixedPoint() {
    }

    /**
     * 10^exponent for exponent in [0, 18].
     */
    public static long pow10(int exponent) {
        if (exponent < 0 || exponent > MAX_DECIMALS) {
            throw new VaultException(VaultErrorCode.MATH_OVERFLOW, "10^" + exponent + " does not fit in 64 bits");
        }
        return POW10[exponent];
    }

    public static long add(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new VaultException(VaultErrorCode.MATH_OVERFLOW, a + " + " + b, e);
        }
    }

    public static long subtract(long a, long b) {
        try {
            return Math.subtractExact(a, b);
        } catch (ArithmeticException e) {
            throw new VaultException(VaultErrorCode.MATH_OVERFLOW, a + " - " + b, e);
        }
    }

    public static long multiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new VaultException(VaultErrorCode.MATH_OVERFLOW, a + " * " + b, e);
        }
    }

    public static long divide(long a, long b) {
        if (b == 0) {
            throw new VaultException(VaultErrorCode.MATH_OVERFLOW, "division of " + a + " by zero");
        }
        if (a == Long.MIN_VALUE && b == -1) {
            throw new VaultException(VaultErrorCode.MATH_OVERFLOW, a + " / " + b);
        }
        return a / b;
    }

    /**
     * a * b / c with a wide intermediate product, truncating toward zero.
     */
    public static long mulDiv(long a, long b, long c) {
        if (c == 0) {
            throw new VaultException(VaultErrorCode.MATH_OVERFLOW, "division of " + a + " * " + b + " by zero");
        }
        BigInteger quotient = BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(c));
        return toLong(quotient);
    }

    /**
     * Narrow a wide value back to 64 bits or fail.
     */
    public static long toLong(BigInteger value) {
        if (value.bitLength() > 63) {
            throw new VaultException(VaultErrorCode.MATH_OVERFLOW, value + " does not fit in 64 bits");
        }
        return value.longValue();
    }
}
