package com.lendmatch.core.accounting;

import java.math.BigInteger;
import lombok.Value;

/**
 * Split of an incoming amount into the part a bookkeeping step absorbed and the part
 * left for the next step. {@code applied + remainder} always equals the input.
 */
@Value
public class AmountSplit {

    BigInteger applied;
    BigInteger remainder;

    public static AmountSplit untouched(BigInteger amount) {
        return new AmountSplit(BigInteger.ZERO, amount);
    }
}
