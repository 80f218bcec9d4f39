package com.lendmatch.risk;

import java.math.BigInteger;
import lombok.Value;

@Value
public class LiquidationAuthorization {

    LiquidationRegime regime;

    /** Share of the borrow that may be repaid, basis points. */
    BigInteger closeFactor;

    /** Borrower's health factor at authorization; null when not computed. */
    BigInteger healthFactor;
}
