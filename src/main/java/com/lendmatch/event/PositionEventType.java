package com.lendmatch.event;

public enum PositionEventType {
    SUPPLIED,
    BORROWED,
    REPAID,
    WITHDRAWN,
    COLLATERAL_SUPPLIED,
    COLLATERAL_WITHDRAWN,
    /** A user's balances were moved between pool and P2P by the matching engine. */
    POSITION_UPDATED
}
