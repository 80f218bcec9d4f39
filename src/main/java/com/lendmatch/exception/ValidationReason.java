package com.lendmatch.exception;

public enum ValidationReason {
    ADDRESS_IS_ZERO,
    AMOUNT_IS_ZERO,
    DEBT_IS_ZERO,
    SUPPLY_IS_ZERO,
    COLLATERAL_IS_ZERO,
    INVALID_PERCENTAGE,
    INVALID_MAX_LOOPS,
    MARKET_NOT_CREATED
}
