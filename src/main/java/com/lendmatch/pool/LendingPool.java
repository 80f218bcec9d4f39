package com.lendmatch.pool;

import com.lendmatch.domain.model.ReserveConfiguration;
import com.lendmatch.domain.model.ReserveIndexes;
import java.math.BigInteger;

/**
 * The underlying lending pool the optimizer sits on. Every position the optimizer
 * cannot match P2P is held here, in the optimizer's own name.
 *
 * <p>The mutating calls may call back into arbitrary code in a real deployment, so
 * callers finish their bookkeeping before issuing them.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@code SimulatedLendingPool}: in-memory pool used by default and in tests</li>
 * </ul>
 */
public interface LendingPool {

    // ---- Liquidity ----

    /**
     * @throws com.lendmatch.exception.PoolException if the pool rejects the supply
     *     (e.g. supply cap reached)
     */
    void supply(String asset, BigInteger amount);

    /**
     * @throws com.lendmatch.exception.PoolException if the pool lacks liquidity
     */
    void withdraw(String asset, BigInteger amount);

    /**
     * @throws com.lendmatch.exception.PoolException if borrowing is refused
     */
    void borrow(String asset, BigInteger amount);

    void repay(String asset, BigInteger amount);

    // ---- Reserve data ----

    ReserveConfiguration getConfiguration(String asset);

    /** Current pool supply and borrow indexes (RAY). */
    ReserveIndexes getReserveIndexes(String asset);

    /** Total supplied to the pool for {@code asset}, all suppliers, in asset units. */
    BigInteger getTotalSupply(String asset);

    /** Total borrowed from the pool for {@code asset}, all borrowers, in asset units. */
    BigInteger getTotalBorrow(String asset);
}
