package com.lendmatch.event;

public enum MarketEventType {
    CREATED,
    INDEXES_UPDATED,
    P2P_TOTALS_UPDATED,
    SUPPLY_DELTA_UPDATED,
    BORROW_DELTA_UPDATED,
    IDLE_SUPPLY_UPDATED,
    PAUSE_STATUS_SET,
    COLLATERAL_STATUS_SET
}
