package com.lendmatch.unit.event;

import static org.assertj.core.api.Assertions.assertThat;

import com.lendmatch.domain.enums.Side;
import com.lendmatch.event.EventPublisherHelper;
import com.lendmatch.event.MarketEvent;
import com.lendmatch.event.MarketEventType;
import com.lendmatch.event.PositionEvent;
import com.lendmatch.event.PositionEventType;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EventPublisherHelperTest {

    private final List<Object> published = new ArrayList<>();
    private EventPublisherHelper eventPublisherHelper;

    @BeforeEach
    void setUp() {
        eventPublisherHelper = new EventPublisherHelper(published::add);
    }

    @Test
    @DisplayName("Outside a transaction events are published immediately")
    void notBuffering_publishesImmediately() {
        eventPublisherHelper.publishMarketEvent(this, "0xdai", MarketEventType.CREATED, Map.of());

        assertThat(published).hasSize(1);
        assertThat(((MarketEvent) published.get(0)).getAsset()).isEqualTo("0xdai");
    }

    @Test
    @DisplayName("Buffered events are delivered in order on flush")
    void flush_preservesOrder() {
        eventPublisherHelper.beginBuffering();
        eventPublisherHelper.publishPositionUpdated(this, Side.BORROW, "0xbob", "0xdai", BigInteger.ZERO, BigInteger.TEN);
        eventPublisherHelper.publishMarketEvent(this, "0xdai", MarketEventType.P2P_TOTALS_UPDATED, Map.of());

        assertThat(published).isEmpty();
        assertThat(eventPublisherHelper.pendingCount()).isEqualTo(2);

        eventPublisherHelper.flush();

        assertThat(published).hasSize(2);
        assertThat(((PositionEvent) published.get(0)).getEventType()).isEqualTo(PositionEventType.POSITION_UPDATED);
        assertThat(published.get(1)).isInstanceOf(MarketEvent.class);
    }

    @Test
    @DisplayName("Discard drops buffered events and stops buffering")
    void discard_dropsEvents() {
        eventPublisherHelper.beginBuffering();
        eventPublisherHelper.publishMarketEvent(this, "0xdai", MarketEventType.CREATED, Map.of());

        eventPublisherHelper.discard();
        eventPublisherHelper.publishMarketEvent(this, "0xdai", MarketEventType.INDEXES_UPDATED, Map.of());

        assertThat(published).hasSize(1);
        assertThat(((MarketEvent) published.get(0)).getEventType()).isEqualTo(MarketEventType.INDEXES_UPDATED);
    }
}
