package com.lendmatch.risk;

/**
 * Why a liquidation was allowed, which also fixes its close factor.
 */
public enum LiquidationRegime {
    /** Borrowed market is deprecated: full close, health factor not checked. */
    DEPRECATED_MARKET,
    /** Health factor between the bad-debt and default thresholds: sentinel-gated, partial close. */
    DEFAULT,
    /** Health factor below the bad-debt threshold: full close. */
    BAD_DEBT
}
