package com.basketvault.engine.price;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;

import java.math.BigInteger;

/**
 * Fair-value conversion between two assets at current prices, no fees or slippage.
 */
public final class SwapMath {

    private SwapMath() {
    }

    /**
     * amount_out = amount_in * from_price * 10^to_decimals / (to_price * 10^from_decimals), truncated.
     *
     * A zero input or a dust output yields 0; callers decide whether that is an error.
     *
     * @throws VaultException INVALID_AMOUNT for a negative input, MATH_OVERFLOW if the output exceeds 64 bits
     */
    public static long quote(long amountIn, NormalizedPrice fromPrice, NormalizedPrice toPrice,
                             int fromDecimals, int toDecimals) {
        if (amountIn < 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT, "negative swap input " + amountIn);
        }
        BigInteger numerator = BigInteger.valueOf(amountIn)
                .multiply(BigInteger.valueOf(fromPrice.usdMicro()))
                .multiply(BigInteger.valueOf(FixedPoint.pow10(toDecimals)));
        BigInteger denominator = BigInteger.valueOf(toPrice.usdMicro())
                .multiply(BigInteger.valueOf(FixedPoint.pow10(fromDecimals)));

        return FixedPoint.toLong(numerator.divide(denominator));
    }

    /**
     * Apply a slippage tolerance in basis points, truncating.
     */
    public static long minimumOutput(long expectedOut, int slippageBps) {
        if (slippageBps < 0 || slippageBps >= 10_000) {
            throw new IllegalArgumentException("slippageBps must be 0-9999, got " + slippageBps);
        }
        return FixedPoint.mulDiv(expectedOut, 10_000L - slippageBps, 10_000L);
    }
}
