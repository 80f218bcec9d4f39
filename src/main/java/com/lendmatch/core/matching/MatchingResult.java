package com.lendmatch.core.matching;

import java.math.BigInteger;
import lombok.Value;

/**
 * Outcome of a matching run: how much was moved and how many iterations it took.
 */
@Value
public class MatchingResult {

    public static final MatchingResult NONE = new MatchingResult(BigInteger.ZERO, 0);

    BigInteger matched;
    int loopsUsed;
}
