package com.lendmatch.domain.model;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Risk and cap parameters of an asset as configured on the underlying pool.
 *
 * <p>Caps are expressed in asset units; zero means no cap. Percentages are in basis points.
 */
@Value
@Builder(toBuilder = true)
public class ReserveConfiguration {

    boolean borrowingEnabled;

    /** E-mode category of the asset; 0 when the asset belongs to none. */
    int eModeCategory;

    @Builder.Default
    BigInteger supplyCap = BigInteger.ZERO;

    @Builder.Default
    BigInteger borrowCap = BigInteger.ZERO;

    /** Loan-to-value: share of collateral value that may be borrowed against. */
    @Builder.Default
    BigInteger ltv = BigInteger.ZERO;

    /** Share of collateral value counted towards the health factor. */
    @Builder.Default
    BigInteger liquidationThreshold = BigInteger.ZERO;

    /** Seizure multiplier for liquidators, e.g. 10 500 = 5% bonus. */
    @Builder.Default
    BigInteger liquidationBonus = BigInteger.valueOf(10_000);

    int decimals;

    public BigInteger unit() {
        return BigInteger.TEN.pow(decimals);
    }
}
