package com.lendmatch.domain.model;

import java.math.BigInteger;
import lombok.Value;

/**
 * Pool indexes of an asset as reported by the pool (RAY).
 */
@Value
public class ReserveIndexes {

    BigInteger poolSupplyIndex;
    BigInteger poolBorrowIndex;
}
