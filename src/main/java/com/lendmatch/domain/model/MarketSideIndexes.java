package com.lendmatch.domain.model;

import com.lendmatch.core.math.WadRayMath;
import java.math.BigInteger;
import lombok.Value;
import lombok.With;

/**
 * Pool and P2P index of one market side, RAY-normalized.
 */
@Value
@With
public class MarketSideIndexes {

    BigInteger poolIndex;
    BigInteger p2pIndex;

    public static MarketSideIndexes initial(BigInteger poolIndex) {
        return new MarketSideIndexes(poolIndex, WadRayMath.RAY);
    }
}
