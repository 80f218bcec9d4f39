package com.lendmatch.risk;

import java.math.BigInteger;
import lombok.Value;

/**
 * Debt a liquidator repays (borrowed asset units) and collateral they receive in
 * return (collateral asset units).
 */
@Value
public class SeizeAmounts {

    BigInteger repaid;
    BigInteger seized;
}
