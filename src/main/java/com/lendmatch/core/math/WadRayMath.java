package com.lendmatch.core.math;

import java.math.BigInteger;

/**
 * Fixed-point arithmetic on WAD (1e18) and RAY (1e27) scaled integers.
 *
 * <p>Indexes are RAY-normalized: multiplying a scaled balance by its index yields
 * the asset amount. Health factors are WAD-normalized.
 *
 * <p>Every operation comes in three flavours: half-up ({@code rayMul}, {@code rayDiv}),
 * floor ({@code *Down}) and ceiling ({@code *Up}). Callers pick the flavour from the
 * rounding table: credits round down, debits round up.
 */
public final class WadRayMath {

    public static final BigInteger WAD = BigInteger.TEN.pow(18);
    public static final BigInteger HALF_WAD = WAD.shiftRight(1);
    public static final BigInteger RAY = BigInteger.TEN.pow(27);
    public static final BigInteger HALF_RAY = RAY.shiftRight(1);

    private WadRayMath() {}

    // ---- RAY ----

    public static BigInteger rayMul(BigInteger x, BigInteger y) {
        return x.multiply(y).add(HALF_RAY).divide(RAY);
    }

    public static BigInteger rayMulDown(BigInteger x, BigInteger y) {
        return x.multiply(y).divide(RAY);
    }

    public static BigInteger rayMulUp(BigInteger x, BigInteger y) {
        return divUp(x.multiply(y), RAY);
    }

    public static BigInteger rayDiv(BigInteger x, BigInteger y) {
        requireNonZero(y);
        return x.multiply(RAY).add(y.shiftRight(1)).divide(y);
    }

    public static BigInteger rayDivDown(BigInteger x, BigInteger y) {
        requireNonZero(y);
        return x.multiply(RAY).divide(y);
    }

    public static BigInteger rayDivUp(BigInteger x, BigInteger y) {
        requireNonZero(y);
        return divUp(x.multiply(RAY), y);
    }

    // ---- WAD ----

    public static BigInteger wadMul(BigInteger x, BigInteger y) {
        return x.multiply(y).add(HALF_WAD).divide(WAD);
    }

    public static BigInteger wadDiv(BigInteger x, BigInteger y) {
        requireNonZero(y);
        return x.multiply(WAD).add(y.shiftRight(1)).divide(y);
    }

    /** Ceiling division of non-negative integers. */
    public static BigInteger divUp(BigInteger x, BigInteger y) {
        requireNonZero(y);
        if (x.signum() == 0) {
            return BigInteger.ZERO;
        }
        return x.subtract(BigInteger.ONE).divide(y).add(BigInteger.ONE);
    }

    private static void requireNonZero(BigInteger divisor) {
        if (divisor.signum() == 0) {
            throw new ArithmeticException("Division by zero");
        }
    }
}
