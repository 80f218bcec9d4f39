package com.lendmatch.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when market-level bookkeeping changes: creation, index refresh, delta or
 * P2P total updates, idle supply changes and operator flag changes.
 *
 * <p>The details map holds the new values, for example:
 * <ul>
 *   <li>P2P_TOTALS_UPDATED: {"scaledTotalSupplyP2P": ..., "scaledTotalBorrowP2P": ...}</li>
 *   <li>SUPPLY_DELTA_UPDATED: {"scaledDelta": ...}</li>
 *   <li>PAUSE_STATUS_SET: {"pauseStatuses": PauseStatuses}</li>
 * </ul>
 */
public class MarketEvent extends ApplicationEvent {

    private final String asset;
    private final MarketEventType eventType;
    private final Map<String, Object> details;

    public MarketEvent(Object source, String asset, MarketEventType eventType, Map<String, Object> details) {
        super(source);
        this.asset = asset;
        this.eventType = eventType;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public String getAsset() {
        return asset;
    }

    public MarketEventType getEventType() {
        return eventType;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
