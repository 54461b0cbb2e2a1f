package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import com.synthetic.solvency.domain.model.Health;

import java.math.BigInteger;

/**
 * Integer arithmetic over 8-decimal fixed-point prices and percentage ratios.
 * Every division truncates toward zero. Products are evaluated exactly and the
 * result must fit a non-negative {@code long}, otherwise the operation fails
 * with {@link SolvencyErrorCode#ARITHMETIC_ERROR}.
 */
public final class FixedPointMath {

    public static final long PRICE_SCALE = 100_000_000L;
    public static final long PERCENT = 100L;
    public static final long BPS_DENOMINATOR = 10_000L;

    private static final BigInteger BIG_PRICE_SCALE = BigInteger.valueOf(PRICE_SCALE);
    private static final BigInteger BIG_PERCENT = BigInteger.valueOf(PERCENT);
    private static final BigInteger MINTABLE_SCALE = BigInteger.valueOf(PRICE_SCALE / PERCENT);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private FixedPointMath() {
    }

    public static long add(long a, long b) {
        requireNonNegative(a, b);
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw overflow("add", e);
        }
    }

    public static long sub(long a, long b) {
        requireNonNegative(a, b);
        if (b > a) {
            throw new SolvencyException(SolvencyErrorCode.ARITHMETIC_ERROR,
                    "underflow: " + a + " - " + b);
        }
        return a - b;
    }

    public static long mulDiv(long a, long b, long divisor) {
        requireNonNegative(a, b, divisor);
        if (divisor == 0) {
            throw new SolvencyException(SolvencyErrorCode.ARITHMETIC_ERROR, "division by zero");
        }
        BigInteger result = BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(divisor));
        return narrow(result);
    }

    /**
     * {@code (collateral * price * 100) / (debt * 1e8)}, or unbounded without debt.
     */
    public static Health positionHealth(long collateral, long debt, long price) {
        requireNonNegative(collateral, debt, price);
        if (debt == 0) {
            return Health.UNBOUNDED;
        }
        BigInteger numerator = BigInteger.valueOf(collateral)
                .multiply(BigInteger.valueOf(price))
                .multiply(BIG_PERCENT);
        BigInteger denominator = BigInteger.valueOf(debt).multiply(BIG_PRICE_SCALE);
        return Health.ratio(narrow(numerator.divide(denominator)));
    }

    /**
     * {@code (collateral * price) / (ratio * 1_000_000)}.
     */
    public static long maxMintable(long collateral, long price, long ratioPercent) {
        requireNonNegative(collateral, price, ratioPercent);
        if (ratioPercent == 0) {
            throw new SolvencyException(SolvencyErrorCode.ARITHMETIC_ERROR, "collateral ratio must be positive");
        }
        BigInteger numerator = BigInteger.valueOf(collateral).multiply(BigInteger.valueOf(price));
        BigInteger denominator = BigInteger.valueOf(ratioPercent).multiply(MINTABLE_SCALE);
        return narrow(numerator.divide(denominator));
    }

    public static long percentOf(long value, long percent) {
        return mulDiv(value, percent, PERCENT);
    }

    public static long bpsOf(long value, long bps) {
        return mulDiv(value, bps, BPS_DENOMINATOR);
    }

    /**
     * Collateral units worth {@code debt} synthetic units at {@code price}.
     */
    public static long collateralValue(long debt, long price) {
        return mulDiv(debt, PRICE_SCALE, price);
    }

    public static boolean isFresh(long lastUpdate, long now, long stalenessLimit) {
        return sub(now, lastUpdate) < stalenessLimit;
    }

    private static long narrow(BigInteger value) {
        if (value.compareTo(LONG_MAX) > 0) {
            throw new SolvencyException(SolvencyErrorCode.ARITHMETIC_ERROR, "overflow: " + value);
        }
        return value.longValue();
    }

    private static void requireNonNegative(long... values) {
        for (long value : values) {
            if (value < 0) {
                throw new SolvencyException(SolvencyErrorCode.ARITHMETIC_ERROR,
                        "negative operand: " + value);
            }
        }
    }

    private static SolvencyException overflow(String op, ArithmeticException cause) {
        return new SolvencyException(SolvencyErrorCode.ARITHMETIC_ERROR, "overflow in " + op, cause);
    }
}
