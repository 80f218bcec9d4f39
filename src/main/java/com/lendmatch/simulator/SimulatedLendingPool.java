package com.lendmatch.simulator;

import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.model.ReserveConfiguration;
import com.lendmatch.domain.model.ReserveIndexes;
import com.lendmatch.exception.PoolException;
import com.lendmatch.pool.LendingPool;
import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * In-memory {@link LendingPool}. Reserves are listed explicitly with their configuration
 * and indexes; indexes only move when {@link #setReserveIndexes} is called, so interest
 * accrual is driven by the caller.
 *
 * <p>Totals are kept scaled by the current indexes, like the real pool does. Supply and
 * borrow caps, the borrowing switch and available liquidity are enforced; violations
 * surface as {@link PoolException}. Liquidity owned by other pool users can be seeded
 * with {@link #addExternalSupply}.
 *
 * <p>Active unless {@code lendmatch.simulator.enabled=false}.
 */
@Service
@ConditionalOnProperty(prefix = "lendmatch.simulator", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedLendingPool implements LendingPool {

    private static final Logger log = LoggerFactory.getLogger(SimulatedLendingPool.class);

    private final Map<String, Reserve> reserves = new ConcurrentHashMap<>();

    // ---- Setup ----

    public synchronized void listReserve(String asset, ReserveConfiguration configuration, ReserveIndexes indexes) {
        reserves.put(asset, new Reserve(configuration, indexes));
        log.info("Simulated pool listed {} ({} decimals)", asset, configuration.getDecimals());
    }

    public synchronized void setConfiguration(String asset, ReserveConfiguration configuration) {
        reserve(asset).configuration = configuration;
    }

    public synchronized void setReserveIndexes(String asset, ReserveIndexes indexes) {
        reserve(asset).indexes = indexes;
    }

    /** Adds supply owned by other pool users, counted in totals and liquidity. */
    public synchronized void addExternalSupply(String asset, BigInteger amount) {
        Reserve reserve = reserve(asset);
        reserve.scaledSupply = reserve.scaledSupply.add(scaleSupply(reserve, amount));
    }

    public boolean isListed(String asset) {
        return reserves.containsKey(asset);
    }

    // ---- Liquidity ----

    @Override
    public synchronized void supply(String asset, BigInteger amount) {
        Reserve reserve = reserve(asset);
        BigInteger supplyCap = reserve.configuration.getSupplyCap();
        if (supplyCap.signum() != 0 && totalSupply(reserve).add(amount).compareTo(supplyCap) > 0) {
            throw new PoolException(asset, "Supply cap exceeded for " + asset);
        }
        reserve.scaledSupply = reserve.scaledSupply.add(scaleSupply(reserve, amount));
        log.debug("Simulated pool supply {} {}", amount, asset);
    }

    @Override
    public synchronized void withdraw(String asset, BigInteger amount) {
        Reserve reserve = reserve(asset);
        if (amount.compareTo(availableLiquidity(reserve)) > 0) {
            throw new PoolException(asset, "Insufficient liquidity to withdraw " + amount + " " + asset);
        }
        reserve.scaledSupply = zeroFloor(reserve.scaledSupply.subtract(scaleSupply(reserve, amount)));
        log.debug("Simulated pool withdraw {} {}", amount, asset);
    }

    @Override
    public synchronized void borrow(String asset, BigInteger amount) {
        Reserve reserve = reserve(asset);
        ReserveConfiguration configuration = reserve.configuration;
        if (!configuration.isBorrowingEnabled()) {
            throw new PoolException(asset, "Borrowing disabled for " + asset);
        }
        BigInteger borrowCap = configuration.getBorrowCap();
        if (borrowCap.signum() != 0 && totalBorrow(reserve).add(amount).compareTo(borrowCap) > 0) {
            throw new PoolException(asset, "Borrow cap exceeded for " + asset);
        }
        if (amount.compareTo(availableLiquidity(reserve)) > 0) {
            throw new PoolException(asset, "Insufficient liquidity to borrow " + amount + " " + asset);
        }
        reserve.scaledBorrow = reserve.scaledBorrow.add(scaleBorrow(reserve, amount));
        log.debug("Simulated pool borrow {} {}", amount, asset);
    }

    @Override
    public synchronized void repay(String asset, BigInteger amount) {
        Reserve reserve = reserve(asset);
        reserve.scaledBorrow = zeroFloor(reserve.scaledBorrow.subtract(scaleBorrow(reserve, amount)));
        log.debug("Simulated pool repay {} {}", amount, asset);
    }

    // ---- Reserve data ----

    @Override
    public synchronized ReserveConfiguration getConfiguration(String asset) {
        return reserve(asset).configuration;
    }

    @Override
    public synchronized ReserveIndexes getReserveIndexes(String asset) {
        return reserve(asset).indexes;
    }

    @Override
    public synchronized BigInteger getTotalSupply(String asset) {
        return totalSupply(reserve(asset));
    }

    @Override
    public synchronized BigInteger getTotalBorrow(String asset) {
        return totalBorrow(reserve(asset));
    }

    private Reserve reserve(String asset) {
        Reserve reserve = reserves.get(asset);
        if (reserve == null) {
            throw new PoolException(asset, "Reserve not listed: " + asset);
        }
        return reserve;
    }

    private BigInteger totalSupply(Reserve reserve) {
        return WadRayMath.rayMul(reserve.scaledSupply, reserve.indexes.getPoolSupplyIndex());
    }

    private BigInteger totalBorrow(Reserve reserve) {
        return WadRayMath.rayMul(reserve.scaledBorrow, reserve.indexes.getPoolBorrowIndex());
    }

    private BigInteger availableLiquidity(Reserve reserve) {
        return zeroFloor(totalSupply(reserve).subtract(totalBorrow(reserve)));
    }

    private BigInteger scaleSupply(Reserve reserve, BigInteger amount) {
        return WadRayMath.rayDiv(amount, reserve.indexes.getPoolSupplyIndex());
    }

    private BigInteger scaleBorrow(Reserve reserve, BigInteger amount) {
        return WadRayMath.rayDiv(amount, reserve.indexes.getPoolBorrowIndex());
    }

    private static BigInteger zeroFloor(BigInteger value) {
        return value.signum() < 0 ? BigInteger.ZERO : value;
    }

    private static final class Reserve {

        private ReserveConfiguration configuration;
        private ReserveIndexes indexes;
        private BigInteger scaledSupply = BigInteger.ZERO;
        private BigInteger scaledBorrow = BigInteger.ZERO;

        private Reserve(ReserveConfiguration configuration, ReserveIndexes indexes) {
            this.configuration = configuration;
            this.indexes = indexes;
        }
    }
}
