package com.lendmatch.core.math;

import java.math.BigInteger;

public final class MathUtils {

    private MathUtils() {}

    /** {@code max(x - y, 0)}: balances never go negative. */
    public static BigInteger zeroFloorSub(BigInteger x, BigInteger y) {
        return x.compareTo(y) <= 0 ? BigInteger.ZERO : x.subtract(y);
    }
}
