package com.lendmatch.domain.model;

import com.lendmatch.domain.enums.MarketAction;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Operator switches of a market. All false on creation.
 */
@Value
@With
@Builder(toBuilder = true)
public class PauseStatuses {

    public static final PauseStatuses NONE = PauseStatuses.builder().build();

    boolean isP2PDisabled;
    boolean isDeprecated;
    boolean isSupplyPaused;
    boolean isBorrowPaused;
    boolean isRepayPaused;
    boolean isWithdrawPaused;
    boolean isSupplyCollateralPaused;
    boolean isWithdrawCollateralPaused;
    boolean isLiquidateCollateralPaused;
    boolean isLiquidateBorrowPaused;

    public boolean isPaused(MarketAction action) {
        return switch (action) {
            case SUPPLY -> isSupplyPaused;
            case BORROW -> isBorrowPaused;
            case REPAY -> isRepayPaused;
            case WITHDRAW -> isWithdrawPaused;
            case SUPPLY_COLLATERAL -> isSupplyCollateralPaused;
            case WITHDRAW_COLLATERAL -> isWithdrawCollateralPaused;
            case LIQUIDATE_COLLATERAL -> isLiquidateCollateralPaused;
            case LIQUIDATE_BORROW -> isLiquidateBorrowPaused;
        };
    }

    public PauseStatuses withPaused(MarketAction action, boolean paused) {
        return switch (action) {
            case SUPPLY -> withSupplyPaused(paused);
            case BORROW -> withBorrowPaused(paused);
            case REPAY -> withRepayPaused(paused);
            case WITHDRAW -> withWithdrawPaused(paused);
            case SUPPLY_COLLATERAL -> withSupplyCollateralPaused(paused);
            case WITHDRAW_COLLATERAL -> withWithdrawCollateralPaused(paused);
            case LIQUIDATE_COLLATERAL -> withLiquidateCollateralPaused(paused);
            case LIQUIDATE_BORROW -> withLiquidateBorrowPaused(paused);
        };
    }

    public PauseStatuses withAllPaused(boolean paused) {
        PauseStatuses result = this;
        for (MarketAction action : MarketAction.values()) {
            result = result.withPaused(action, paused);
        }
        return result;
    }
}
