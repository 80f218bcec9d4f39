package com.lendmatch.event;

import com.lendmatch.domain.enums.Side;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Wrapper around Spring's {@link ApplicationEventPublisher} with typed factory methods
 * for every lendmatch event.
 *
 * <p>While a ledger transaction is open ({@link #beginBuffering()}), events are held
 * back and only delivered on {@link #flush()}; {@link #discard()} drops them when the
 * operation rolls back. Outside a transaction events go straight to Spring.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final List<ApplicationEvent> buffer = new ArrayList<>();
    private boolean buffering;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Buffering ----

    public void beginBuffering() {
        buffer.clear();
        buffering = true;
    }

    /** Publishes buffered events in emission order and stops buffering. */
    public void flush() {
        buffering = false;
        List<ApplicationEvent> pending = new ArrayList<>(buffer);
        buffer.clear();
        pending.forEach(applicationEventPublisher::publishEvent);
    }

    public void discard() {
        buffering = false;
        buffer.clear();
    }

    public int pendingCount() {
        return buffer.size();
    }

    // ---- Positions ----

    public void publishPositionEvent(PositionEvent event) {
        dispatch(event);
    }

    public void publishPositionUpdated(
            Object source, Side side, String user, String asset, BigInteger scaledOnPool, BigInteger scaledInP2P) {
        dispatch(PositionEvent.builder()
                .source(source)
                .eventType(PositionEventType.POSITION_UPDATED)
                .side(side)
                .onBehalf(user)
                .asset(asset)
                .scaledOnPool(scaledOnPool)
                .scaledInP2P(scaledInP2P)
                .build());
    }

    // ---- Liquidation ----

    public void publishLiquidated(
            Object source,
            String liquidator,
            String borrower,
            String borrowAsset,
            BigInteger repaid,
            String collateralAsset,
            BigInteger seized) {
        dispatch(new LiquidationEvent(source, liquidator, borrower, borrowAsset, repaid, collateralAsset, seized));
    }

    // ---- Market ----

    public void publishMarketEvent(Object source, String asset, MarketEventType eventType, Map<String, Object> details) {
        dispatch(new MarketEvent(source, asset, eventType, details));
    }

    private void dispatch(ApplicationEvent event) {
        if (buffering) {
            buffer.add(event);
        } else {
            applicationEventPublisher.publishEvent(event);
        }
    }
}
