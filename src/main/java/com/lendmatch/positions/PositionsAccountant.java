package com.lendmatch.positions;

import com.lendmatch.core.accounting.AmountSplit;
import com.lendmatch.core.accounting.DeltaAccounting;
import com.lendmatch.core.matching.MatchingEngine;
import com.lendmatch.core.matching.MatchingResult;
import com.lendmatch.core.math.ScaledMath;
import com.lendmatch.core.math.ScaledMath.Withdrawal;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.FlowBreakdown;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.ledger.Market;
import com.lendmatch.ledger.MarketBalances;
import com.lendmatch.pool.LendingPool;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ledger bookkeeping of the four money flows and the two collateral flows.
 *
 * <p>Methods only touch ledger state (balances, deltas, P2P totals, idle supply) and
 * report what the pool must do; issuing the pool calls is left to the caller, after
 * all bookkeeping is done. Inputs are assumed validated and, for repay and withdraw,
 * capped to the user's balance. Market indexes must be fresh.
 */
@Component
public class PositionsAccountant {

    private static final Logger log = LoggerFactory.getLogger(PositionsAccountant.class);

    private final Ledger ledger;
    private final DeltaAccounting deltaAccounting;
    private final MatchingEngine matchingEngine;
    private final LendingPool lendingPool;

    public PositionsAccountant(
            Ledger ledger, DeltaAccounting deltaAccounting, MatchingEngine matchingEngine, LendingPool lendingPool) {
        this.ledger = ledger;
        this.deltaAccounting = deltaAccounting;
        this.matchingEngine = matchingEngine;
        this.lendingPool = lendingPool;
    }

    // ========================
    // SUPPLY
    // ========================

    /**
     * Supply: borrow delta first, then pool borrowers promoted to P2P, the rest on pool.
     */
    public SupplyRepayAccounting accountSupply(String asset, BigInteger amount, String onBehalf, int maxLoops) {
        Market market = ledger.getMarket(asset);
        MarketBalances balances = ledger.getBalances(asset);
        Indexes indexes = market.getIndexes();

        BigInteger onPool = balances.scaledPoolSupplyBalance(onBehalf);
        BigInteger inP2P = balances.scaledP2PSupplyBalance(onBehalf);
        BigInteger remaining = amount;
        BigInteger fromDelta = BigInteger.ZERO;
        BigInteger promoted = BigInteger.ZERO;

        if (!market.isP2PDisabled()) {
            AmountSplit delta = deltaAccounting.decreaseDelta(
                    market, Side.BORROW, remaining, indexes.getBorrow().getPoolIndex());
            fromDelta = delta.getApplied();
            remaining = delta.getRemainder();

            promoted = matchingEngine.promote(asset, Side.BORROW, remaining, maxLoops).getMatched();
            remaining = remaining.subtract(promoted);

            inP2P = inP2P.add(deltaAccounting.increaseP2P(market, promoted, fromDelta.add(promoted), Side.SUPPLY));
        }

        onPool = onPool.add(ScaledMath.credit(remaining, indexes.getSupply().getPoolIndex()));
        ledger.updateSupplier(asset, onBehalf, onPool, inP2P);

        log.debug("{} supply {} for {}: delta={}, p2p={}, pool={}", asset, amount, onBehalf, fromDelta, promoted, remaining);
        return SupplyRepayAccounting.builder()
                .toRepay(fromDelta.add(promoted))
                .toSupply(remaining)
                .onPool(onPool)
                .inP2P(inP2P)
                .breakdown(FlowBreakdown.builder()
                        .toPool(remaining)
                        .toP2P(promoted)
                        .toDelta(fromDelta)
                        .build())
                .build();
    }

    // ========================
    // BORROW
    // ========================

    /**
     * Borrow: idle supply first, then supply delta, then pool suppliers promoted to
     * P2P, the rest borrowed on pool.
     */
    public BorrowWithdrawAccounting accountBorrow(String asset, BigInteger amount, String onBehalf, int maxLoops) {
        Market market = ledger.getMarket(asset);
        MarketBalances balances = ledger.getBalances(asset);
        Indexes indexes = market.getIndexes();

        BigInteger onPool = balances.scaledPoolBorrowBalance(onBehalf);
        BigInteger inP2P = balances.scaledP2PBorrowBalance(onBehalf);
        BigInteger remaining = amount;
        BigInteger fromIdle = BigInteger.ZERO;
        BigInteger fromDelta = BigInteger.ZERO;
        BigInteger promoted = BigInteger.ZERO;

        if (!market.isP2PDisabled()) {
            AmountSplit idle = deltaAccounting.decreaseIdle(market, remaining);
            fromIdle = idle.getApplied();
            remaining = idle.getRemainder();

            AmountSplit delta = deltaAccounting.decreaseDelta(
                    market, Side.SUPPLY, remaining, indexes.getSupply().getPoolIndex());
            fromDelta = delta.getApplied();
            remaining = delta.getRemainder();

            promoted = matchingEngine.promote(asset, Side.SUPPLY, remaining, maxLoops).getMatched();
            remaining = remaining.subtract(promoted);

            inP2P = inP2P.add(deltaAccounting.increaseP2P(
                    market, promoted, fromIdle.add(fromDelta).add(promoted), Side.BORROW));
        }

        onPool = onPool.add(ScaledMath.credit(remaining, indexes.getBorrow().getPoolIndex()));
        ledger.updateBorrower(asset, onBehalf, onPool, inP2P);

        log.debug(
                "{} borrow {} for {}: idle={}, delta={}, p2p={}, pool={}",
                asset, amount, onBehalf, fromIdle, fromDelta, promoted, remaining);
        return BorrowWithdrawAccounting.builder()
                .toWithdraw(fromDelta.add(promoted))
                .toBorrow(remaining)
                .onPool(onPool)
                .inP2P(inP2P)
                .breakdown(FlowBreakdown.builder()
                        .toPool(remaining)
                        .toP2P(promoted)
                        .toDelta(fromDelta)
                        .toIdle(fromIdle)
                        .build())
                .build();
    }

    // ========================
    // REPAY
    // ========================

    /**
     * Repay: the borrower's pool debt first, then their P2P debt. Repaid P2P volume
     * leaves suppliers unmatched, which is resolved in order: borrow delta, accrued
     * fee, pool borrowers promoted to P2P, idle supply (supply cap), suppliers demoted
     * to the pool, and finally a new supply delta.
     */
    public SupplyRepayAccounting accountRepay(String asset, BigInteger amount, String onBehalf, int maxLoops) {
        Market market = ledger.getMarket(asset);
        MarketBalances balances = ledger.getBalances(asset);
        Indexes indexes = market.getIndexes();

        Withdrawal fromPool = ScaledMath.take(
                balances.scaledPoolBorrowBalance(onBehalf), indexes.getBorrow().getPoolIndex(), amount, Side.BORROW);
        Withdrawal fromP2P = ScaledMath.take(
                balances.scaledP2PBorrowBalance(onBehalf),
                indexes.getBorrow().getP2pIndex(),
                amount.subtract(fromPool.getTaken()),
                Side.BORROW);
        BigInteger onPool = fromPool.getRemainingScaled();
        BigInteger inP2P = fromP2P.getRemainingScaled();
        ledger.updateBorrower(asset, onBehalf, onPool, inP2P);

        BigInteger poolRepaid = fromPool.getTaken();
        BigInteger remaining = fromP2P.getTaken();
        if (remaining.signum() == 0) {
            return SupplyRepayAccounting.builder()
                    .toRepay(poolRepaid)
                    .toSupply(BigInteger.ZERO)
                    .onPool(onPool)
                    .inP2P(inP2P)
                    .breakdown(FlowBreakdown.builder().toPool(poolRepaid).build())
                    .build();
        }

        // Delta: P2P borrow already backed by the pool.
        AmountSplit delta = deltaAccounting.decreaseDelta(
                market, Side.BORROW, remaining, indexes.getBorrow().getPoolIndex());
        BigInteger fromDelta = delta.getApplied();
        remaining = delta.getRemainder();
        deltaAccounting.decreaseP2P(market, BigInteger.ZERO, fromDelta, Side.BORROW);

        BigInteger afterFee = deltaAccounting.repayFee(market, remaining);
        BigInteger fee = remaining.subtract(afterFee);
        remaining = afterFee;

        MatchingResult promotion = matchingEngine.promote(asset, Side.BORROW, remaining, maxLoops);
        BigInteger promoted = promotion.getMatched();
        remaining = remaining.subtract(promoted);

        // What is left breaks supplier matches.
        AmountSplit idle = deltaAccounting.increaseIdle(
                market, remaining, lendingPool.getConfiguration(asset), lendingPool.getTotalSupply(asset));
        BigInteger toIdle = idle.getApplied();
        BigInteger toSupply = idle.getRemainder();

        BigInteger demoted = matchingEngine
                .demote(asset, Side.SUPPLY, toSupply, maxLoops - promotion.getLoopsUsed())
                .getMatched();
        BigInteger newDelta = toSupply.subtract(demoted);
        deltaAccounting.increaseDelta(market, Side.SUPPLY, newDelta, indexes.getSupply().getPoolIndex());
        deltaAccounting.decreaseP2P(market, demoted, remaining, Side.BORROW);

        log.debug(
                "{} repay {} for {}: pool={}, delta={}, fee={}, p2p={}, idle={}, demoted={}, newDelta={}",
                asset, amount, onBehalf, poolRepaid, fromDelta, fee, promoted, toIdle, demoted, newDelta);
        return SupplyRepayAccounting.builder()
                .toRepay(poolRepaid.add(fromDelta).add(promoted))
                .toSupply(toSupply)
                .onPool(onPool)
                .inP2P(inP2P)
                .breakdown(FlowBreakdown.builder()
                        .toPool(poolRepaid.add(demoted))
                        .toP2P(promoted)
                        .toDelta(fromDelta.add(newDelta))
                        .toIdle(toIdle)
                        .toFee(fee)
                        .build())
                .build();
    }

    // ========================
    // WITHDRAW
    // ========================

    /**
     * Withdraw: the supplier's pool supply first, then their P2P supply. Withdrawn P2P
     * volume leaves borrowers unmatched, which is resolved in order: idle supply,
     * supply delta, pool suppliers promoted to P2P, borrowers demoted to the pool, and
     * finally a new borrow delta.
     */
    public BorrowWithdrawAccounting accountWithdraw(String asset, BigInteger amount, String onBehalf, int maxLoops) {
        Market market = ledger.getMarket(asset);
        MarketBalances balances = ledger.getBalances(asset);
        Indexes indexes = market.getIndexes();

        Withdrawal fromPool = ScaledMath.take(
                balances.scaledPoolSupplyBalance(onBehalf), indexes.getSupply().getPoolIndex(), amount, Side.SUPPLY);
        Withdrawal fromP2P = ScaledMath.take(
                balances.scaledP2PSupplyBalance(onBehalf),
                indexes.getSupply().getP2pIndex(),
                amount.subtract(fromPool.getTaken()),
                Side.SUPPLY);
        BigInteger onPool = fromPool.getRemainingScaled();
        BigInteger inP2P = fromP2P.getRemainingScaled();
        ledger.updateSupplier(asset, onBehalf, onPool, inP2P);

        BigInteger poolWithdrawn = fromPool.getTaken();
        BigInteger remaining = fromP2P.getTaken();
        if (remaining.signum() == 0) {
            return BorrowWithdrawAccounting.builder()
                    .toWithdraw(poolWithdrawn)
                    .toBorrow(BigInteger.ZERO)
                    .onPool(onPool)
                    .inP2P(inP2P)
                    .breakdown(FlowBreakdown.builder().toPool(poolWithdrawn).build())
                    .build();
        }
        BigInteger p2pWithdrawn = remaining;

        AmountSplit idle = deltaAccounting.decreaseIdle(market, remaining);
        BigInteger fromIdle = idle.getApplied();
        remaining = idle.getRemainder();

        AmountSplit delta = deltaAccounting.decreaseDelta(
                market, Side.SUPPLY, remaining, indexes.getSupply().getPoolIndex());
        BigInteger fromDelta = delta.getApplied();
        remaining = delta.getRemainder();

        MatchingResult promotion = matchingEngine.promote(asset, Side.SUPPLY, remaining, maxLoops);
        BigInteger promoted = promotion.getMatched();
        remaining = remaining.subtract(promoted);

        // What is left breaks borrower matches.
        BigInteger demoted = matchingEngine
                .demote(asset, Side.BORROW, remaining, maxLoops - promotion.getLoopsUsed())
                .getMatched();
        BigInteger newDelta = remaining.subtract(demoted);
        deltaAccounting.increaseDelta(market, Side.BORROW, newDelta, indexes.getBorrow().getPoolIndex());
        deltaAccounting.decreaseP2P(market, demoted, p2pWithdrawn.subtract(promoted), Side.SUPPLY);

        log.debug(
                "{} withdraw {} for {}: pool={}, idle={}, delta={}, p2p={}, demoted={}, newDelta={}",
                asset, amount, onBehalf, poolWithdrawn, fromIdle, fromDelta, promoted, demoted, newDelta);
        return BorrowWithdrawAccounting.builder()
                .toWithdraw(poolWithdrawn.add(fromDelta).add(promoted))
                .toBorrow(remaining)
                .onPool(onPool)
                .inP2P(inP2P)
                .breakdown(FlowBreakdown.builder()
                        .toPool(poolWithdrawn.add(demoted))
                        .toP2P(promoted)
                        .toDelta(fromDelta.add(newDelta))
                        .toIdle(fromIdle)
                        .build())
                .build();
    }

    // ========================
    // COLLATERAL
    // ========================

    /** @return the user's new scaled collateral */
    public BigInteger accountSupplyCollateral(String asset, BigInteger amount, String onBehalf) {
        BigInteger poolSupplyIndex = ledger.getMarket(asset).getIndexes().getSupply().getPoolIndex();
        BigInteger collateral = ledger.getBalances(asset)
                .scaledCollateralBalance(onBehalf)
                .add(ScaledMath.credit(amount, poolSupplyIndex));
        ledger.updateCollateral(asset, onBehalf, collateral);
        return collateral;
    }

    /** @return the user's new scaled collateral */
    public BigInteger accountWithdrawCollateral(String asset, BigInteger amount, String onBehalf) {
        BigInteger poolSupplyIndex = ledger.getMarket(asset).getIndexes().getSupply().getPoolIndex();
        Withdrawal withdrawal = ScaledMath.take(
                ledger.getBalances(asset).scaledCollateralBalance(onBehalf), poolSupplyIndex, amount, Side.SUPPLY);
        ledger.updateCollateral(asset, onBehalf, withdrawal.getRemainingScaled());
        return withdrawal.getRemainingScaled();
    }
}
