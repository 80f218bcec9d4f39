package com.lendmatch.core.accounting;

import com.lendmatch.core.math.PercentageMath;
import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.domain.model.MarketSideDelta;
import com.lendmatch.domain.model.MarketSideIndexes;
import com.lendmatch.domain.model.ReserveIndexes;
import com.lendmatch.ledger.Market;
import java.math.BigInteger;
import org.springframework.stereotype.Component;

/**
 * Derives the P2P indexes of a market from fresh pool indexes.
 *
 * <p>P2P rates sit between the pool's supply and borrow rates at the market's
 * {@code p2pIndexCursor}, with the reserve factor pulling both ends back towards the
 * pool. The share of P2P volume that actually sits on the pool (delta) or idle earns
 * pool growth (respectively nothing) instead of P2P growth.
 */
@Component
public class InterestRatesModel {

    /**
     * @return the market's new indexes; P2P indexes are unchanged when the pool
     *     indexes did not move
     */
    public Indexes computeIndexes(Market market, ReserveIndexes pool) {
        Indexes last = market.getIndexes();

        BigInteger poolSupplyGrowth =
                WadRayMath.rayDiv(pool.getPoolSupplyIndex(), last.getSupply().getPoolIndex());
        BigInteger poolBorrowGrowth =
                WadRayMath.rayDiv(pool.getPoolBorrowIndex(), last.getBorrow().getPoolIndex());

        BigInteger p2pSupplyGrowth;
        BigInteger p2pBorrowGrowth;
        if (poolSupplyGrowth.compareTo(poolBorrowGrowth) <= 0) {
            BigInteger p2pGrowth =
                    PercentageMath.weightedAvg(poolSupplyGrowth, poolBorrowGrowth, market.getP2pIndexCursor());
            p2pSupplyGrowth = p2pGrowth.subtract(
                    PercentageMath.percentMul(p2pGrowth.subtract(poolSupplyGrowth), market.getReserveFactor()));
            p2pBorrowGrowth = p2pGrowth.add(
                    PercentageMath.percentMul(poolBorrowGrowth.subtract(p2pGrowth), market.getReserveFactor()));
        } else {
            // Pool spread inverted: P2P follows the borrow rate on both sides.
            p2pSupplyGrowth = poolBorrowGrowth;
            p2pBorrowGrowth = poolBorrowGrowth;
        }

        BigInteger proportionIdle = proportionIdle(market);

        BigInteger p2pSupplyIndex = computeP2PIndex(
                poolSupplyGrowth, p2pSupplyGrowth, last.getSupply(), market.getDelta(Side.SUPPLY), proportionIdle);
        BigInteger p2pBorrowIndex = computeP2PIndex(
                poolBorrowGrowth, p2pBorrowGrowth, last.getBorrow(), market.getDelta(Side.BORROW), BigInteger.ZERO);

        return new Indexes(
                new MarketSideIndexes(pool.getPoolSupplyIndex(), p2pSupplyIndex),
                new MarketSideIndexes(pool.getPoolBorrowIndex(), p2pBorrowIndex));
    }

    private BigInteger proportionIdle(Market market) {
        BigInteger idleSupply = market.getIdleSupply();
        if (idleSupply.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger totalP2PSupply = WadRayMath.rayMul(
                market.getDelta(Side.SUPPLY).getScaledP2PTotal(),
                market.getIndexes().getSupply().getP2pIndex());
        if (totalP2PSupply.signum() == 0) {
            return BigInteger.ZERO;
        }
        return WadRayMath.RAY.min(WadRayMath.rayDivUp(idleSupply, totalP2PSupply));
    }

    private BigInteger computeP2PIndex(
            BigInteger poolGrowth,
            BigInteger p2pGrowth,
            MarketSideIndexes last,
            MarketSideDelta delta,
            BigInteger proportionIdle) {
        BigInteger totalP2P = WadRayMath.rayMul(delta.getScaledP2PTotal(), last.getP2pIndex());
        if (delta.getScaledP2PTotal().signum() == 0 || totalP2P.signum() == 0) {
            return WadRayMath.rayMul(last.getP2pIndex(), p2pGrowth);
        }

        BigInteger proportionDelta = WadRayMath.rayDivUp(
                        WadRayMath.rayMul(delta.getScaledDelta(), last.getPoolIndex()), totalP2P)
                .min(WadRayMath.RAY.subtract(proportionIdle));

        BigInteger matchedShare = WadRayMath.RAY.subtract(proportionDelta).subtract(proportionIdle);
        BigInteger blendedGrowth = WadRayMath.rayMul(matchedShare, p2pGrowth)
                .add(WadRayMath.rayMul(proportionDelta, poolGrowth))
                .add(proportionIdle);
        return WadRayMath.rayMul(last.getP2pIndex(), blendedGrowth);
    }
}
