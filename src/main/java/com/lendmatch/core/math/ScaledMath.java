package com.lendmatch.core.math;

import com.lendmatch.domain.enums.Side;
import java.math.BigInteger;
import lombok.Value;

/**
 * Conversions between asset amounts and index-scaled balances, with the rounding
 * direction fixed by what the conversion does to a user's claim:
 *
 * <ul>
 *   <li>crediting a balance rounds down</li>
 *   <li>debiting a balance rounds up</li>
 *   <li>valuing a supply balance rounds down, valuing a debt rounds up</li>
 * </ul>
 */
public final class ScaledMath {

    private ScaledMath() {}

    public static BigInteger credit(BigInteger amount, BigInteger index) {
        return WadRayMath.rayDivDown(amount, index);
    }

    public static BigInteger debit(BigInteger amount, BigInteger index) {
        return WadRayMath.rayDivUp(amount, index);
    }

    public static BigInteger value(BigInteger scaled, BigInteger index, Side side) {
        return side == Side.SUPPLY ? WadRayMath.rayMulDown(scaled, index) : WadRayMath.rayMulUp(scaled, index);
    }

    /**
     * Takes up to {@code amount} (asset units) out of a scaled balance. When the amount
     * covers the whole balance the balance is cleared outright, so a full unwind never
     * leaves scaled dust behind.
     *
     * @return the amount actually taken and the new scaled balance
     */
    public static Withdrawal take(BigInteger scaled, BigInteger index, BigInteger amount, Side side) {
        if (scaled.signum() == 0 || amount.signum() == 0) {
            return new Withdrawal(BigInteger.ZERO, scaled);
        }
        BigInteger available = value(scaled, index, side);
        if (amount.compareTo(available) >= 0) {
            return new Withdrawal(available, BigInteger.ZERO);
        }
        return new Withdrawal(amount, MathUtils.zeroFloorSub(scaled, debit(amount, index)));
    }

    /** Result of {@link #take}. */
    @Value
    public static class Withdrawal {
        BigInteger taken;
        BigInteger remainingScaled;
    }
}
