package com.lendmatch.pool;

import java.math.BigInteger;

/**
 * Asset prices in the oracle's base currency, per whole unit of the asset.
 */
public interface PriceOracle {

    /**
     * @throws com.lendmatch.exception.PoolException if no price is available
     */
    BigInteger getPrice(String asset);
}
