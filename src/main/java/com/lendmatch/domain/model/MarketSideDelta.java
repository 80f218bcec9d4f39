package com.lendmatch.domain.model;

import java.math.BigInteger;
import lombok.Value;
import lombok.With;

/**
 * Delta bookkeeping of one market side.
 *
 * <p>{@code scaledDelta} is P2P volume of this side that actually sits on the pool
 * (pool-index units). {@code scaledP2PTotal} is the side's total P2P volume
 * (P2P-index units), independent of how individual users hold it.
 */
@Value
@With
public class MarketSideDelta {

    public static final MarketSideDelta ZERO = new MarketSideDelta(BigInteger.ZERO, BigInteger.ZERO);

    BigInteger scaledDelta;
    BigInteger scaledP2PTotal;
}
