package com.lendmatch.risk;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Data;

/**
 * Thresholds of the liquidation state machine and the optimizer-wide e-mode setting.
 *
 * <p>Health-factor thresholds are WAD (1e18 = 1.0); close factors are basis points.
 * Loaded from {@code lendmatch.risk.*} by {@link com.lendmatch.config.RiskConfig}.
 */
@Data
@Builder
public class RiskParameters {

    // ==================== Health Factor Thresholds ====================

    /** Below this health factor a user is liquidatable. */
    private BigInteger defaultLiquidationThreshold;

    /**
     * Below this health factor the position is treated as bad debt: the sentinel is not
     * consulted and the whole debt may be closed.
     */
    private BigInteger minLiquidationThreshold;

    // ==================== Close Factors ====================

    /** Share of a borrow that may be repaid while above the bad-debt threshold. */
    private BigInteger defaultCloseFactor;

    /** Share of a borrow that may be repaid below it, or on a deprecated market. */
    private BigInteger maxCloseFactor;

    // ==================== E-Mode ====================

    /** E-mode category the optimizer runs in; 0 when none. */
    private int eModeCategoryId;
}
