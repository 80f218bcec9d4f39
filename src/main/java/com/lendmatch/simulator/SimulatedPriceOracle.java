package com.lendmatch.simulator;

import com.lendmatch.exception.PoolException;
import com.lendmatch.pool.PriceOracle;
import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Fixed prices set by hand.
 */
@Service
@ConditionalOnProperty(prefix = "lendmatch.simulator", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedPriceOracle implements PriceOracle {

    private final Map<String, BigInteger> prices = new ConcurrentHashMap<>();

    public void setPrice(String asset, BigInteger price) {
        prices.put(asset, price);
    }

    @Override
    public BigInteger getPrice(String asset) {
        BigInteger price = prices.get(asset);
        if (price == null) {
            throw new PoolException(asset, "No price for " + asset);
        }
        return price;
    }
}
