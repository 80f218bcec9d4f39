package com.lendmatch.integration;

import static com.lendmatch.support.LendingStack.big;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.event.LiquidationEvent;
import com.lendmatch.event.PositionEvent;
import com.lendmatch.exception.UnauthorizedException;
import com.lendmatch.ledger.Market;
import com.lendmatch.ledger.MarketBalances;
import com.lendmatch.observability.CustomMetricsService;
import com.lendmatch.positions.LiquidationResult;
import com.lendmatch.risk.LiquidationRegime;
import com.lendmatch.support.LendingStack;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Liquidation of a fully matched borrower across the whole stack: risk checks, seize
 * amounts, supplier demotion, pool calls and the committed event stream.
 */
class LiquidationIntegrationTest {

    private static final String DAI = "0xdai";
    private static final String WETH = "0xweth";
    private static final String ALICE = "0xalice";
    private static final String BOB = "0xbob";
    private static final String CAROL = "0xcarol";

    private LendingStack stack;

    @BeforeEach
    void setUp() {
        stack = new LendingStack(1_000);
        stack.listMarket(DAI);
        stack.listCollateralMarket(WETH);

        stack.positionsManager.supply(ALICE, DAI, big(1_000), ALICE, 4);
        stack.positionsManager.supplyCollateral(BOB, WETH, big(1_000), BOB);
        stack.positionsManager.borrow(BOB, DAI, big(790), BOB, BOB, 4);
    }

    @Test
    @DisplayName("Matched debt is repaid by demoting the supplier and the collateral goes to the liquidator")
    void liquidate_matchedDebt() {
        stack.oracle.setPrice(WETH, big(90_000_000));

        LiquidationResult result = stack.positionsManager.liquidate(CAROL, DAI, WETH, BOB, big(1_000));

        assertThat(result.getRegime()).isEqualTo(LiquidationRegime.DEFAULT);
        assertThat(result.getRepaid()).isEqualTo(big(395));
        assertThat(result.getSeized()).isEqualTo(big(460));
        assertThat(result.getRepayBreakdown().getToPool()).isEqualTo(big(395));

        // borrower
        assertThat(stack.lens.borrowBalance(DAI, BOB)).isEqualTo(big(395));
        assertThat(stack.lens.collateralBalance(WETH, BOB)).isEqualTo(big(540));
        assertThat(stack.lens.healthFactor(BOB)).isGreaterThan(WadRayMath.WAD);

        // supplier keeps the full balance, half of it moved back to the pool
        MarketBalances balances = stack.ledger.getBalances(DAI);
        assertThat(balances.scaledPoolSupplyBalance(ALICE)).isEqualTo(big(605));
        assertThat(balances.scaledP2PSupplyBalance(ALICE)).isEqualTo(big(395));
        assertThat(stack.lens.supplyBalance(DAI, ALICE)).isEqualTo(big(1_000));

        Market market = stack.ledger.getMarket(DAI);
        assertThat(market.getDelta(Side.SUPPLY).getScaledP2PTotal()).isEqualTo(big(395));
        assertThat(market.getDelta(Side.BORROW).getScaledP2PTotal()).isEqualTo(big(395));

        assertThat(stack.pool.getTotalSupply(DAI)).isEqualTo(big(605));
        assertThat(stack.pool.getTotalSupply(WETH)).isEqualTo(big(540));
    }

    @Test
    @DisplayName("Restored health blocks a second liquidation")
    void liquidate_twice() {
        stack.oracle.setPrice(WETH, big(90_000_000));
        stack.positionsManager.liquidate(CAROL, DAI, WETH, BOB, big(1_000));

        assertThatThrownBy(() -> stack.positionsManager.liquidate(CAROL, DAI, WETH, BOB, big(1_000)))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(stack.lens.borrowBalance(DAI, BOB)).isEqualTo(big(395));
    }

    @Test
    @DisplayName("Committed events drive the liquidation and flow metrics")
    void liquidate_metrics() {
        stack.oracle.setPrice(WETH, big(90_000_000));
        stack.positionsManager.liquidate(CAROL, DAI, WETH, BOB, big(1_000));

        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        CustomMetricsService metrics = new CustomMetricsService(meterRegistry, stack.ledger);
        stack.eventsOf(PositionEvent.class).forEach(metrics::onPositionEvent);
        stack.eventsOf(LiquidationEvent.class).forEach(metrics::onLiquidationEvent);

        assertThat(meterRegistry.get("liquidations.count").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("positions.repaid.count").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("positions.supplied.count").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("positions.borrowed.count").counter().count()).isEqualTo(1.0);
        // alice promoted by the borrow, demoted by the liquidation
        assertThat(meterRegistry.get("matching.positions.updated").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("markets.created").gauge().value()).isEqualTo(2.0);

        LiquidationEvent event = stack.eventsOf(LiquidationEvent.class).get(0);
        assertThat(event.getLiquidator()).isEqualTo(CAROL);
        assertThat(event.getSeized()).isEqualTo(big(460));
    }
}
