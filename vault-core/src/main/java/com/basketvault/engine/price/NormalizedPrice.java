package com.basketvault.engine.price;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.math.FixedPoint;

import java.math.BigInteger;

/**
 * A price in canonical micro-USD (6 decimals), together with the raw oracle
 * representation it was derived from.
 *
 * Example: BTC at $50,000 quoted as (5_000_000_000_000, -8) normalizes to
 * 50_000_000_000 micro-USD.
 */
public record NormalizedPrice(
        long usdMicro,      // USD * 10^6, always > 0
        long rawPrice,      // Oracle mantissa
        int rawExponent     // Oracle exponent (price = rawPrice * 10^rawExponent)
) {

    private static final int USD_DECIMALS = 6;

    public NormalizedPrice {
        if (usdMicro <= 0) {
            throw new VaultException(VaultErrorCode.INVALID_PRICE,
                    "normalized price must be positive, got " + usdMicro);
        }
    }

    /**
     * Convert {@code rawPrice * 10^rawExponent} into micro-USD.
     *
     * Sources with more than 6 decimals are divided down (trailing precision is lost),
     * sources with fewer are multiplied up. Overflow fails with MATH_OVERFLOW, a
     * non-positive price or one that truncates to zero fails with INVALID_PRICE.
     */
    public static NormalizedPrice normalize(long rawPrice, int rawExponent) {
        if (rawPrice <= 0) {
            throw new VaultException(VaultErrorCode.INVALID_PRICE,
                    "raw price must be positive, got " + rawPrice);
        }

        long usdMicro;
        if (rawExponent < -USD_DECIMALS) {
            // More decimals than micro-USD: divide down
            BigInteger divisor = BigInteger.TEN.pow(-rawExponent - USD_DECIMALS);
            usdMicro = FixedPoint.toLong(BigInteger.valueOf(rawPrice).divide(divisor));
        } else if (rawExponent > -USD_DECIMALS) {
            int shift = rawExponent + USD_DECIMALS;
            if (shift > FixedPoint.MAX_DECIMALS) {
                throw new VaultException(VaultErrorCode.MATH_OVERFLOW,
                        "exponent " + rawExponent + " overflows micro-USD");
            }
            usdMicro = FixedPoint.multiply(rawPrice, FixedPoint.pow10(shift));
        } else {
            usdMicro = rawPrice;
        }

        if (usdMicro <= 0) {
            throw new VaultException(VaultErrorCode.INVALID_PRICE,
                    "price " + rawPrice + "e" + rawExponent + " truncates to zero micro-USD");
        }
        return new NormalizedPrice(usdMicro, rawPrice, rawExponent);
    }

    /**
     * Price that is already expressed in micro-USD (mock oracle).
     */
    public static NormalizedPrice ofUsdMicro(long usdMicro) {
        return normalize(usdMicro, -USD_DECIMALS);
    }

    /**
     * Native token amount worth {@code usdMicro} at this price, truncated.
     */
    public long usdToTokens(long usdMicro, int tokenDecimals) {
        if (usdMicro < 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT, "negative USD amount " + usdMicro);
        }
        return FixedPoint.mulDiv(usdMicro, FixedPoint.pow10(tokenDecimals), this.usdMicro);
    }

    /**
     * Micro-USD value of a native token amount, truncated.
     */
    public long tokensToUsd(long amount, int tokenDecimals) {
        if (amount < 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT, "negative token amount " + amount);
        }
        return FixedPoint.mulDiv(amount, this.usdMicro, FixedPoint.pow10(tokenDecimals));
    }
}
