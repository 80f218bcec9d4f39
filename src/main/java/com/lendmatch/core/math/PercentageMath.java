package com.lendmatch.core.math;

import java.math.BigInteger;

/**
 * Basis-point percentages: {@link #PERCENTAGE_FACTOR} (10 000) is 100%.
 */
public final class PercentageMath {

    public static final BigInteger PERCENTAGE_FACTOR = BigInteger.valueOf(10_000);
    public static final BigInteger HALF_PERCENTAGE_FACTOR = BigInteger.valueOf(5_000);

    private PercentageMath() {}

    public static BigInteger percentMul(BigInteger value, BigInteger percentage) {
        return value.multiply(percentage).add(HALF_PERCENTAGE_FACTOR).divide(PERCENTAGE_FACTOR);
    }

    public static BigInteger percentMulDown(BigInteger value, BigInteger percentage) {
        return value.multiply(percentage).divide(PERCENTAGE_FACTOR);
    }

    public static BigInteger percentDiv(BigInteger value, BigInteger percentage) {
        if (percentage.signum() == 0) {
            throw new ArithmeticException("Division by zero percentage");
        }
        return value.multiply(PERCENTAGE_FACTOR).add(percentage.shiftRight(1)).divide(percentage);
    }

    /**
     * Weighted average {@code x * (1 - percentage) + y * percentage}, rounded half-up.
     */
    public static BigInteger weightedAvg(BigInteger x, BigInteger y, BigInteger percentage) {
        BigInteger complement = PERCENTAGE_FACTOR.subtract(percentage);
        return x.multiply(complement)
                .add(y.multiply(percentage))
                .add(HALF_PERCENTAGE_FACTOR)
                .divide(PERCENTAGE_FACTOR);
    }

    public static boolean isValid(BigInteger percentage) {
        return percentage != null && percentage.signum() >= 0 && percentage.compareTo(PERCENTAGE_FACTOR) <= 0;
    }
}
