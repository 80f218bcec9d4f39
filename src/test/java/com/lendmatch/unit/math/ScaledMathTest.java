package com.lendmatch.unit.math;

import static org.assertj.core.api.Assertions.assertThat;

import com.lendmatch.core.math.ScaledMath;
import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.enums.Side;
import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Rounding directions of scaled-balance conversions. An index of 1.5 RAY makes every
 * conversion of a small amount inexact.
 */
class ScaledMathTest {

    private static final BigInteger ONE_AND_HALF = WadRayMath.RAY.multiply(BigInteger.valueOf(3)).divide(BigInteger.TWO);

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    @DisplayName("Credits round down, debits round up")
    void creditDownDebitUp() {
        assertThat(ScaledMath.credit(big(10), ONE_AND_HALF)).isEqualTo(big(6));
        assertThat(ScaledMath.debit(big(10), ONE_AND_HALF)).isEqualTo(big(7));
    }

    @Test
    @DisplayName("Supply is valued down, debt is valued up")
    void valueBySide() {
        assertThat(ScaledMath.value(big(7), ONE_AND_HALF, Side.SUPPLY)).isEqualTo(big(10));
        assertThat(ScaledMath.value(big(7), ONE_AND_HALF, Side.BORROW)).isEqualTo(big(11));
    }

    @Nested
    @DisplayName("take")
    class Take {

        @Test
        @DisplayName("Partial take debits the balance rounded up")
        void partialTake() {
            ScaledMath.Withdrawal withdrawal = ScaledMath.take(big(7), ONE_AND_HALF, big(4), Side.SUPPLY);

            assertThat(withdrawal.getTaken()).isEqualTo(big(4));
            assertThat(withdrawal.getRemainingScaled()).isEqualTo(big(4));
        }

        @Test
        @DisplayName("Taking at least the balance value clears it and caps the amount taken")
        void fullTake_clearsBalance() {
            ScaledMath.Withdrawal withdrawal = ScaledMath.take(big(100), WadRayMath.RAY, big(150), Side.SUPPLY);

            assertThat(withdrawal.getTaken()).isEqualTo(big(100));
            assertThat(withdrawal.getRemainingScaled()).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("Full debt repayment takes the rounded-up debt and leaves no dust")
        void fullDebtTake_noDust() {
            ScaledMath.Withdrawal withdrawal = ScaledMath.take(big(7), ONE_AND_HALF, big(11), Side.BORROW);

            assertThat(withdrawal.getTaken()).isEqualTo(big(11));
            assertThat(withdrawal.getRemainingScaled()).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("Zero amount leaves the balance untouched")
        void zeroAmount_untouched() {
            ScaledMath.Withdrawal withdrawal = ScaledMath.take(big(7), ONE_AND_HALF, BigInteger.ZERO, Side.SUPPLY);

            assertThat(withdrawal.getTaken()).isEqualTo(BigInteger.ZERO);
            assertThat(withdrawal.getRemainingScaled()).isEqualTo(big(7));
        }
    }
}
