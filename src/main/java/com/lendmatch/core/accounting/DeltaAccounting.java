package com.lendmatch.core.accounting;

import static com.lendmatch.core.math.MathUtils.zeroFloorSub;

import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.domain.model.MarketSideDelta;
import com.lendmatch.domain.model.ReserveConfiguration;
import com.lendmatch.event.EventPublisherHelper;
import com.lendmatch.event.MarketEventType;
import com.lendmatch.ledger.Market;
import java.math.BigInteger;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bookkeeping of the mismatch between pool and P2P accounting of a market.
 *
 * <p>Three quantities are tracked per market:
 * <ul>
 *   <li><b>Delta</b> (per side): P2P volume that actually sits on the pool because a
 *       match was broken faster than it could be rebuilt.</li>
 *   <li><b>P2P totals</b> (per side): total P2P volume in P2P-index units.</li>
 *   <li><b>Idle supply</b>: P2P supply parked in the protocol because the pool's supply
 *       cap left no room for it.</li>
 * </ul>
 *
 * <p>Invariant kept by the flows: matched borrow equals matched supply plus the accrued
 * P2P fee, where matched borrow is {@code borrowTotal - borrowDelta} and matched supply is
 * {@code supplyTotal - supplyDelta - idleSupply} (all valued in asset units).
 *
 * <p>Rounding: valuing a delta for consumption rounds up (the whole delta can be
 * consumed, none is left as dust), subtracting the consumed part rounds down, and
 * creating a delta rounds down. P2P totals move with the same rounding as the user
 * balances they mirror: increases down, decreases up.
 */
@Component
public class DeltaAccounting {

    private static final Logger log = LoggerFactory.getLogger(DeltaAccounting.class);

    private final EventPublisherHelper eventPublisherHelper;

    public DeltaAccounting(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // DELTAS
    // ========================

    /**
     * Applies {@code amount} against the side's delta first.
     *
     * @return consumed amount (asset units) and what is left of {@code amount}
     */
    public AmountSplit decreaseDelta(Market market, Side side, BigInteger amount, BigInteger poolIndex) {
        MarketSideDelta delta = market.getDelta(side);
        BigInteger scaledDelta = delta.getScaledDelta();
        if (scaledDelta.signum() == 0 || amount.signum() == 0) {
            return AmountSplit.untouched(amount);
        }

        BigInteger consumed = WadRayMath.rayMulUp(scaledDelta, poolIndex).min(amount);
        BigInteger newScaledDelta = zeroFloorSub(scaledDelta, WadRayMath.rayDivDown(consumed, poolIndex));
        market.setDelta(side, delta.withScaledDelta(newScaledDelta));
        publishDeltaUpdated(market, side, newScaledDelta);

        log.debug("{} {} delta consumed {}, scaled delta now {}", market.getAsset(), side, consumed, newScaledDelta);
        return new AmountSplit(consumed, amount.subtract(consumed));
    }

    /** Records {@code amount} of freshly broken P2P volume as delta. */
    public void increaseDelta(Market market, Side side, BigInteger amount, BigInteger poolIndex) {
        if (amount.signum() == 0) {
            return;
        }
        MarketSideDelta delta = market.getDelta(side);
        BigInteger newScaledDelta = delta.getScaledDelta().add(WadRayMath.rayDivDown(amount, poolIndex));
        market.setDelta(side, delta.withScaledDelta(newScaledDelta));
        publishDeltaUpdated(market, side, newScaledDelta);

        log.debug("{} {} delta increased by {}, scaled delta now {}", market.getAsset(), side, amount, newScaledDelta);
    }

    // ========================
    // P2P TOTALS
    // ========================

    /**
     * Grows the P2P totals after a match: the counterparty side by {@code promoted}, the
     * acting side by {@code amount}.
     *
     * @param actingSide side of the user whose flow created the match
     * @return the acting user's P2P credit in P2P-index units
     */
    public BigInteger increaseP2P(Market market, BigInteger promoted, BigInteger amount, Side actingSide) {
        if (amount.signum() == 0 && promoted.signum() == 0) {
            return BigInteger.ZERO;
        }
        Indexes indexes = market.getIndexes();
        Side counterSide = actingSide.opposite();

        BigInteger counterIncrease = WadRayMath.rayDivDown(promoted, indexes.get(counterSide).getP2pIndex());
        BigInteger actingIncrease = WadRayMath.rayDivDown(amount, indexes.get(actingSide).getP2pIndex());

        MarketSideDelta counter = market.getDelta(counterSide);
        market.setDelta(counterSide, counter.withScaledP2PTotal(counter.getScaledP2PTotal().add(counterIncrease)));
        MarketSideDelta acting = market.getDelta(actingSide);
        market.setDelta(actingSide, acting.withScaledP2PTotal(acting.getScaledP2PTotal().add(actingIncrease)));

        publishP2PTotalsUpdated(market);
        return actingIncrease;
    }

    /**
     * Shrinks the P2P totals after matches are broken: the counterparty side by
     * {@code demoted}, the acting side by {@code amount}. Never goes below zero.
     */
    public void decreaseP2P(Market market, BigInteger demoted, BigInteger amount, Side actingSide) {
        if (amount.signum() == 0 && demoted.signum() == 0) {
            return;
        }
        Indexes indexes = market.getIndexes();
        Side counterSide = actingSide.opposite();

        BigInteger counterDecrease = WadRayMath.rayDivUp(demoted, indexes.get(counterSide).getP2pIndex());
        BigInteger actingDecrease = WadRayMath.rayDivUp(amount, indexes.get(actingSide).getP2pIndex());

        MarketSideDelta counter = market.getDelta(counterSide);
        market.setDelta(
                counterSide, counter.withScaledP2PTotal(zeroFloorSub(counter.getScaledP2PTotal(), counterDecrease)));
        MarketSideDelta acting = market.getDelta(actingSide);
        market.setDelta(
                actingSide, acting.withScaledP2PTotal(zeroFloorSub(acting.getScaledP2PTotal(), actingDecrease)));

        publishP2PTotalsUpdated(market);
    }

    // ========================
    // FEE
    // ========================

    /**
     * Settles the accrued P2P fee out of a repayment. The fee is the excess of matched
     * borrow over matched supply that P2P borrowers accrued while matched.
     *
     * @return what is left of {@code amount} after the fee
     */
    public BigInteger repayFee(Market market, BigInteger amount) {
        if (amount.signum() == 0) {
            return amount;
        }
        BigInteger fee = accruedFee(market);
        if (fee.signum() == 0) {
            return amount;
        }

        BigInteger settled = fee.min(amount);
        MarketSideDelta borrow = market.getDelta(Side.BORROW);
        BigInteger scaledSettled =
                WadRayMath.rayDivDown(settled, market.getIndexes().getBorrow().getP2pIndex());
        market.setDelta(
                Side.BORROW, borrow.withScaledP2PTotal(zeroFloorSub(borrow.getScaledP2PTotal(), scaledSettled)));
        publishP2PTotalsUpdated(market);

        log.debug("{} P2P fee settled: {}", market.getAsset(), settled);
        return amount.subtract(settled);
    }

    /** Accrued P2P fee in asset units. */
    public BigInteger accruedFee(Market market) {
        Indexes indexes = market.getIndexes();
        MarketSideDelta supply = market.getDelta(Side.SUPPLY);
        MarketSideDelta borrow = market.getDelta(Side.BORROW);

        BigInteger matchedBorrow = zeroFloorSub(
                WadRayMath.rayMul(borrow.getScaledP2PTotal(), indexes.getBorrow().getP2pIndex()),
                WadRayMath.rayMul(borrow.getScaledDelta(), indexes.getBorrow().getPoolIndex()));
        BigInteger matchedSupply = zeroFloorSub(
                WadRayMath.rayMul(supply.getScaledP2PTotal(), indexes.getSupply().getP2pIndex()),
                WadRayMath.rayMul(supply.getScaledDelta(), indexes.getSupply().getPoolIndex())
                        .add(market.getIdleSupply()));
        return zeroFloorSub(matchedBorrow, matchedSupply);
    }

    // ========================
    // IDLE SUPPLY
    // ========================

    /**
     * Matches {@code amount} against idle supply first.
     *
     * @return matched idle amount and the remainder
     */
    public AmountSplit decreaseIdle(Market market, BigInteger amount) {
        BigInteger idleSupply = market.getIdleSupply();
        if (idleSupply.signum() == 0 || amount.signum() == 0) {
            return AmountSplit.untouched(amount);
        }
        BigInteger matchedIdle = idleSupply.min(amount);
        BigInteger newIdleSupply = idleSupply.subtract(matchedIdle);
        market.setIdleSupply(newIdleSupply);
        publishIdleSupplyUpdated(market, newIdleSupply);
        return new AmountSplit(matchedIdle, amount.subtract(matchedIdle));
    }

    /**
     * Parks the part of {@code amount} that does not fit under the pool's supply cap as
     * idle supply.
     *
     * @param poolTotalSupply total supplied to the pool for this asset, in asset units
     * @return idle increase ({@code applied}) and the amount still suppliable to the pool
     */
    public AmountSplit increaseIdle(
            Market market, BigInteger amount, ReserveConfiguration reserve, BigInteger poolTotalSupply) {
        BigInteger supplyCap = reserve.getSupplyCap();
        if (supplyCap.signum() == 0 || amount.signum() == 0) {
            return AmountSplit.untouched(amount);
        }
        BigInteger suppliable = zeroFloorSub(supplyCap, poolTotalSupply);
        if (amount.compareTo(suppliable) <= 0) {
            return AmountSplit.untouched(amount);
        }

        BigInteger idleIncrease = amount.subtract(suppliable);
        BigInteger newIdleSupply = market.getIdleSupply().add(idleIncrease);
        market.setIdleSupply(newIdleSupply);
        publishIdleSupplyUpdated(market, newIdleSupply);

        log.debug("{} supply cap reached, {} parked as idle supply", market.getAsset(), idleIncrease);
        return new AmountSplit(idleIncrease, suppliable);
    }

    // ========================
    // EVENTS
    // ========================

    private void publishDeltaUpdated(Market market, Side side, BigInteger scaledDelta) {
        MarketEventType type =
                side == Side.SUPPLY ? MarketEventType.SUPPLY_DELTA_UPDATED : MarketEventType.BORROW_DELTA_UPDATED;
        eventPublisherHelper.publishMarketEvent(this, market.getAsset(), type, Map.of("scaledDelta", scaledDelta));
    }

    private void publishP2PTotalsUpdated(Market market) {
        eventPublisherHelper.publishMarketEvent(
                this,
                market.getAsset(),
                MarketEventType.P2P_TOTALS_UPDATED,
                Map.of(
                        "scaledTotalSupplyP2P", market.getDelta(Side.SUPPLY).getScaledP2PTotal(),
                        "scaledTotalBorrowP2P", market.getDelta(Side.BORROW).getScaledP2PTotal()));
    }

    private void publishIdleSupplyUpdated(Market market, BigInteger idleSupply) {
        eventPublisherHelper.publishMarketEvent(
                this, market.getAsset(), MarketEventType.IDLE_SUPPLY_UPDATED, Map.of("idleSupply", idleSupply));
    }
}
