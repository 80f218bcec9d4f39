package com.lendmatch.domain.model;

import com.lendmatch.core.math.WadRayMath;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregate risk position of a user in the oracle's base currency.
 */
@Value
@Builder
public class LiquidityData {

    /** Health factor reported for users without debt. */
    public static final BigInteger MAX_HEALTH_FACTOR = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    /** Maximum debt allowed by loan-to-value. */
    BigInteger borrowable;

    /** Debt level at which the user becomes liquidatable. */
    BigInteger maxDebt;

    BigInteger debt;

    public BigInteger healthFactor() {
        if (debt.signum() == 0) {
            return MAX_HEALTH_FACTOR;
        }
        return WadRayMath.wadDiv(maxDebt, debt);
    }
}
