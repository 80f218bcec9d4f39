package com.lendmatch.domain.enums;

import com.lendmatch.exception.PolicyReason;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * User-facing actions that an operator can pause independently on each market.
 */
@Getter
@RequiredArgsConstructor
public enum MarketAction {
    SUPPLY(PolicyReason.SUPPLY_PAUSED),
    BORROW(PolicyReason.BORROW_PAUSED),
    REPAY(PolicyReason.REPAY_PAUSED),
    WITHDRAW(PolicyReason.WITHDRAW_PAUSED),
    SUPPLY_COLLATERAL(PolicyReason.SUPPLY_COLLATERAL_PAUSED),
    WITHDRAW_COLLATERAL(PolicyReason.WITHDRAW_COLLATERAL_PAUSED),
    LIQUIDATE_COLLATERAL(PolicyReason.LIQUIDATE_COLLATERAL_PAUSED),
    LIQUIDATE_BORROW(PolicyReason.LIQUIDATE_BORROW_PAUSED);

    /** Reason reported when this action is refused because it is paused. */
    private final PolicyReason pausedReason;
}
