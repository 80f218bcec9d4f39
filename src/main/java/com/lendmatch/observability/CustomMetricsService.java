package com.lendmatch.observability;

import com.lendmatch.event.LiquidationEvent;
import com.lendmatch.event.PositionEvent;
import com.lendmatch.ledger.Ledger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates custom Micrometer metrics for lendmatch.
 *
 * <ul>
 *   <li><b>positions.supplied.count</b> (counter): supply flows</li>
 *   <li><b>positions.borrowed.count</b> (counter): borrow flows</li>
 *   <li><b>positions.repaid.count</b> (counter): repay flows, liquidations included</li>
 *   <li><b>positions.withdrawn.count</b> (counter): withdraw flows</li>
 *   <li><b>liquidations.count</b> (counter): successful liquidations</li>
 *   <li><b>matching.positions.updated</b> (counter): users moved by the matching engine</li>
 *   <li><b>markets.created</b> (gauge): markets in the ledger</li>
 * </ul>
 *
 * <p>Events only reach this service once their operation has committed, so rolled-back
 * operations are never counted.
 */
@Service
public class CustomMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricsService.class);

    private final Counter suppliedCounter;
    private final Counter borrowedCounter;
    private final Counter repaidCounter;
    private final Counter withdrawnCounter;
    private final Counter liquidationsCounter;
    private final Counter positionsUpdatedCounter;

    public CustomMetricsService(MeterRegistry meterRegistry, Ledger ledger) {
        this.suppliedCounter = Counter.builder("positions.supplied.count")
                .description("Total supply operations")
                .register(meterRegistry);

        this.borrowedCounter = Counter.builder("positions.borrowed.count")
                .description("Total borrow operations")
                .register(meterRegistry);

        this.repaidCounter = Counter.builder("positions.repaid.count")
                .description("Total repay operations, liquidations included")
                .register(meterRegistry);

        this.withdrawnCounter = Counter.builder("positions.withdrawn.count")
                .description("Total withdraw operations")
                .register(meterRegistry);

        this.liquidationsCounter = Counter.builder("liquidations.count")
                .description("Total successful liquidations")
                .register(meterRegistry);

        this.positionsUpdatedCounter = Counter.builder("matching.positions.updated")
                .description("Users promoted or demoted by the matching engine")
                .register(meterRegistry);

        // Gauge (lazily evaluated by Micrometer during scrape)
        meterRegistry.gauge("markets.created", ledger, Ledger::getMarketCount);
    }

    /**
     * Runs at @Order(20), after any core listener.
     */
    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        switch (event.getEventType()) {
            case SUPPLIED -> suppliedCounter.increment();
            case BORROWED -> borrowedCounter.increment();
            case REPAID -> repaidCounter.increment();
            case WITHDRAWN -> withdrawnCounter.increment();
            case POSITION_UPDATED -> positionsUpdatedCounter.increment();
            default -> {
                // collateral movements are not counted
            }
        }
    }

    @EventListener
    @Order(20)
    public void onLiquidationEvent(LiquidationEvent event) {
        liquidationsCounter.increment();
        log.info(
                "Liquidation recorded: {} repaid {} {} for {}",
                event.getLiquidator(),
                event.getRepaid(),
                event.getBorrowAsset(),
                event.getBorrower());
    }
}
