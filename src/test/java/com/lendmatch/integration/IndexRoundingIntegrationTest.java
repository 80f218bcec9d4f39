package com.lendmatch.integration;

import static com.lendmatch.support.LendingStack.big;
import static org.assertj.core.api.Assertions.assertThat;

import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.MarketSideDelta;
import com.lendmatch.domain.model.MarketSideIndexes;
import com.lendmatch.ledger.Market;
import com.lendmatch.positions.FlowResult;
import com.lendmatch.support.LendingStack;
import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Flows at indexes that are not whole multiples of RAY, where every conversion between
 * amounts and scaled balances rounds. Users must never withdraw more than they put in,
 * and every processed amount must be fully accounted for.
 */
class IndexRoundingIntegrationTest {

    private static final String DAI = "0xdai";
    private static final String WETH = "0xweth";
    private static final String ALICE = "0xalice";
    private static final String BOB = "0xbob";

    private static final BigInteger ODD_SUPPLY_INDEX = new BigInteger("1234567890123456789012345678");
    private static final BigInteger ODD_BORROW_INDEX = new BigInteger("1376543210987654321098765432");

    private static LendingStack oddIndexStack() {
        LendingStack stack = new LendingStack(1_000);
        stack.listMarket(DAI);
        stack.listCollateralMarket(WETH);
        stack.pool.setReserveIndexes(DAI, LendingStack.indexes(ODD_SUPPLY_INDEX, ODD_BORROW_INDEX));
        stack.marketService.updateIndexes(DAI);
        // liquidity owned by other pool users, so the pool never runs dry on rounding
        stack.pool.addExternalSupply(DAI, big(10_000));
        return stack;
    }

    private static void assertRoundTrips(LendingStack stack) {
        long[] amounts = {2, 7, 13, 101, 999};
        BigInteger totalIn = BigInteger.ZERO;
        BigInteger totalOut = BigInteger.ZERO;

        for (long amount : amounts) {
            stack.positionsManager.supply(ALICE, DAI, big(amount), ALICE, 4);
            assertThat(stack.lens.supplyBalance(DAI, ALICE)).isLessThanOrEqualTo(big(amount));

            FlowResult withdrawal = stack.positionsManager.withdraw(ALICE, DAI, big(1_000_000), ALICE, ALICE, 10);

            assertThat(withdrawal.getAmount()).as("withdrawn after supplying %d", amount)
                    .isLessThanOrEqualTo(big(amount));
            assertThat(withdrawal.getScaledOnPool()).isEqualTo(BigInteger.ZERO);
            assertThat(withdrawal.getScaledInP2P()).isEqualTo(BigInteger.ZERO);
            totalIn = totalIn.add(big(amount));
            totalOut = totalOut.add(withdrawal.getAmount());
        }

        assertThat(totalOut).isLessThanOrEqualTo(totalIn);
        assertThat(stack.lens.supplyBalance(DAI, ALICE)).isEqualTo(BigInteger.ZERO);
    }

    // ==============================
    // ROUND TRIPS
    // ==============================

    @Nested
    @DisplayName("Supply and withdraw cycles")
    class RoundTrips {

        @Test
        @DisplayName("Pool-only cycles never return more than was supplied")
        void poolOnly() {
            LendingStack stack = oddIndexStack();

            assertRoundTrips(stack);
        }

        @Test
        @DisplayName("Cycles matched against a pool borrower never return more than was supplied")
        void matched() {
            LendingStack stack = oddIndexStack();
            stack.positionsManager.supplyCollateral(BOB, WETH, big(1_000), BOB);
            stack.positionsManager.borrow(BOB, DAI, big(300), BOB, BOB, 4);
            assertThat(stack.ledger.getBalances(DAI).scaledPoolBorrowBalance(BOB).signum()).isPositive();

            assertRoundTrips(stack);
        }
    }

    // ==============================
    // FEE SETTLEMENT
    // ==============================

    @Test
    @DisplayName("Repay settling the P2P fee accounts for every unit with a live supply delta")
    void repay_feeSettlement() {
        LendingStack stack = new LendingStack(1_000);
        stack.pool.listReserve(
                DAI, LendingStack.defaultReserve(), LendingStack.indexes(WadRayMath.RAY, WadRayMath.RAY));
        stack.oracle.setPrice(DAI, LendingStack.DEFAULT_PRICE);
        stack.marketService.createMarket(DAI, big(1_000), big(5_000));
        stack.listCollateralMarket(WETH);

        stack.positionsManager.supply(ALICE, DAI, big(1_000_000), ALICE, 4);
        stack.positionsManager.supplyCollateral(BOB, WETH, big(1_000_000), BOB);
        stack.positionsManager.borrow(BOB, DAI, big(600_000), BOB, BOB, 4);
        // no loop budget: the broken matches stay P2P on alice's side, backed by a supply delta
        stack.positionsManager.repay(BOB, DAI, big(100_000), BOB, 0);
        assertThat(stack.ledger.getMarket(DAI).getDelta(Side.SUPPLY).getScaledDelta()).isEqualTo(big(100_000));

        BigInteger supplyIndex = WadRayMath.RAY.multiply(big(11)).divide(BigInteger.TEN);
        BigInteger borrowIndex = WadRayMath.RAY.multiply(big(13)).divide(BigInteger.TEN);
        stack.pool.setReserveIndexes(DAI, LendingStack.indexes(supplyIndex, borrowIndex));
        stack.marketService.updateIndexes(DAI);
        BigInteger feeBefore = stack.lens.market(DAI).getAccruedFee();
        assertThat(feeBefore.signum()).isPositive();

        FlowResult repayment = stack.positionsManager.repay(BOB, DAI, big(200_000), BOB, 10);

        assertThat(repayment.getAmount()).isEqualTo(big(200_000));
        assertThat(repayment.getBreakdown().total()).isEqualTo(big(200_000));
        assertThat(repayment.getBreakdown().getToFee()).isEqualTo(feeBefore);
        assertThat(stack.lens.market(DAI).getAccruedFee()).isLessThan(feeBefore);

        Market market = stack.ledger.getMarket(DAI);
        for (Side side : Side.values()) {
            MarketSideDelta delta = market.getDelta(side);
            MarketSideIndexes indexes = market.getIndexes().get(side);
            assertThat(WadRayMath.rayMul(delta.getScaledDelta(), indexes.getPoolIndex()))
                    .as("%s delta within P2P volume", side)
                    .isLessThanOrEqualTo(WadRayMath.rayMul(delta.getScaledP2PTotal(), indexes.getP2pIndex()));
        }
    }
}
