package com.lendmatch.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PolicyReason {
    SUPPLY_PAUSED("Supply is paused"),
    BORROW_PAUSED("Borrow is paused"),
    REPAY_PAUSED("Repay is paused"),
    WITHDRAW_PAUSED("Withdraw is paused"),
    SUPPLY_COLLATERAL_PAUSED("Supply collateral is paused"),
    WITHDRAW_COLLATERAL_PAUSED("Withdraw collateral is paused"),
    LIQUIDATE_COLLATERAL_PAUSED("Liquidate collateral is paused"),
    LIQUIDATE_BORROW_PAUSED("Liquidate borrow is paused"),
    BORROW_NOT_ENABLED("Borrowing is not enabled on the pool"),
    BORROW_CAP_EXCEEDED("Borrow cap exceeded"),
    INCONSISTENT_E_MODE("Asset is outside the configured e-mode category"),
    ASSET_NOT_COLLATERAL("Asset is not enabled as collateral"),
    DEPRECATION_REQUIRES_BORROW_PAUSE("Borrow must be paused before deprecation"),
    MARKET_DEPRECATED("Market is deprecated");

    private final String description;
}
