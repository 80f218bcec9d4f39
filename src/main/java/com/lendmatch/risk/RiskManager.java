package com.lendmatch.risk;

import com.lendmatch.domain.enums.MarketAction;
import com.lendmatch.domain.model.LiquidityData;
import com.lendmatch.domain.model.ReserveConfiguration;
import com.lendmatch.exception.AuthorizationReason;
import com.lendmatch.exception.PolicyException;
import com.lendmatch.exception.PolicyReason;
import com.lendmatch.exception.UnauthorizedException;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.ledger.Market;
import com.lendmatch.pool.LendingPool;
import com.lendmatch.pool.LiquidationSentinel;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Risk gate of the positions manager. Decides whether a borrow, a collateral
 * withdrawal or a liquidation may go ahead.
 *
 * <p>Borrow policy (pool switches, e-mode, caps) is checked before any accounting.
 * Borrow and collateral-withdrawal health checks run after accounting, against the
 * would-be position; a refusal throws and the ledger transaction rolls the accounting
 * back.
 *
 * <p>Liquidation state machine, in evaluation order:
 * <ol>
 *   <li>borrowed or collateral market paused for liquidation: refused</li>
 *   <li>borrowed market deprecated: allowed with the max close factor</li>
 *   <li>health factor at or above the default threshold: refused</li>
 *   <li>health factor at or above the bad-debt threshold: allowed with the default close
 *       factor if the sentinel agrees</li>
 *   <li>otherwise: allowed with the max close factor</li>
 * </ol>
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private final Ledger ledger;
    private final LendingPool lendingPool;
    private final LiquidationSentinel liquidationSentinel;
    private final LiquidityCalculator liquidityCalculator;
    private final RiskParameters riskParameters;

    public RiskManager(
            Ledger ledger,
            LendingPool lendingPool,
            LiquidationSentinel liquidationSentinel,
            LiquidityCalculator liquidityCalculator,
            RiskParameters riskParameters) {
        this.ledger = ledger;
        this.lendingPool = lendingPool;
        this.liquidationSentinel = liquidationSentinel;
        this.liquidityCalculator = liquidityCalculator;
        this.riskParameters = riskParameters;
    }

    // ========================
    // BORROW
    // ========================

    /**
     * Pool-side borrow policy: borrowing switched on, asset inside the configured
     * e-mode category, borrow cap not exceeded.
     */
    public void validateBorrowPolicy(String asset, BigInteger amount) {
        ReserveConfiguration configuration = lendingPool.getConfiguration(asset);
        if (!configuration.isBorrowingEnabled()) {
            throw new PolicyException(PolicyReason.BORROW_NOT_ENABLED, asset);
        }

        int eModeCategoryId = riskParameters.getEModeCategoryId();
        if (eModeCategoryId != 0 && eModeCategoryId != configuration.getEModeCategory()) {
            throw new PolicyException(PolicyReason.INCONSISTENT_E_MODE, asset);
        }

        BigInteger borrowCap = configuration.getBorrowCap();
        if (borrowCap.signum() != 0
                && lendingPool.getTotalBorrow(asset).add(amount).compareTo(borrowCap) > 0) {
            throw new PolicyException(PolicyReason.BORROW_CAP_EXCEEDED, asset);
        }
    }

    /** Refuses if the user's debt, as accounted, exceeds what their collateral allows. */
    public void authorizeBorrow(String user) {
        LiquidityData liquidityData = liquidityCalculator.liquidityData(user);
        if (liquidityData.getDebt().compareTo(liquidityData.getBorrowable()) > 0) {
            log.warn(
                    "Borrow refused for {}: debt {} above borrowable {}",
                    user,
                    liquidityData.getDebt(),
                    liquidityData.getBorrowable());
            throw new UnauthorizedException(
                    AuthorizationReason.UNAUTHORIZED_BORROW,
                    user,
                    "Borrow exceeds the collateral's borrowing capacity");
        }
    }

    // ========================
    // COLLATERAL
    // ========================

    /** Refuses if the user's health factor, as accounted, fell below the default threshold. */
    public void authorizeWithdrawCollateral(String user) {
        BigInteger healthFactor = liquidityCalculator.healthFactor(user);
        if (healthFactor.compareTo(riskParameters.getDefaultLiquidationThreshold()) < 0) {
            log.warn("Collateral withdrawal refused for {}: health factor {}", user, healthFactor);
            throw new UnauthorizedException(
                    AuthorizationReason.UNAUTHORIZED_WITHDRAW, user, "Withdrawal would make the position unhealthy");
        }
    }

    // ========================
    // LIQUIDATION
    // ========================

    /**
     * @return regime and close factor of an allowed liquidation
     * @throws PolicyException       if either market is paused for liquidation
     * @throws UnauthorizedException if the borrower is healthy or the sentinel refuses
     */
    public LiquidationAuthorization authorizeLiquidate(String borrowAsset, String collateralAsset, String borrower) {
        Market collateralMarket = ledger.getMarket(collateralAsset);
        Market borrowMarket = ledger.getMarket(borrowAsset);

        if (collateralMarket.getPauseStatuses().isPaused(MarketAction.LIQUIDATE_COLLATERAL)) {
            throw new PolicyException(PolicyReason.LIQUIDATE_COLLATERAL_PAUSED, collateralAsset);
        }
        if (borrowMarket.getPauseStatuses().isPaused(MarketAction.LIQUIDATE_BORROW)) {
            throw new PolicyException(PolicyReason.LIQUIDATE_BORROW_PAUSED, borrowAsset);
        }

        if (borrowMarket.isDeprecated()) {
            return new LiquidationAuthorization(
                    LiquidationRegime.DEPRECATED_MARKET, riskParameters.getMaxCloseFactor(), null);
        }

        BigInteger healthFactor = liquidityCalculator.healthFactor(borrower);
        if (healthFactor.compareTo(riskParameters.getDefaultLiquidationThreshold()) >= 0) {
            throw new UnauthorizedException(
                    AuthorizationReason.UNAUTHORIZED_LIQUIDATE,
                    borrower,
                    "Borrower " + borrower + " is not liquidatable");
        }

        if (healthFactor.compareTo(riskParameters.getMinLiquidationThreshold()) >= 0) {
            if (!liquidationSentinel.isLiquidationAllowed()) {
                throw new UnauthorizedException(
                        AuthorizationReason.SENTINEL_LIQUIDATE_NOT_ENABLED,
                        borrower,
                        "Liquidation sentinel does not allow liquidations");
            }
            return new LiquidationAuthorization(
                    LiquidationRegime.DEFAULT, riskParameters.getDefaultCloseFactor(), healthFactor);
        }

        return new LiquidationAuthorization(LiquidationRegime.BAD_DEBT, riskParameters.getMaxCloseFactor(), healthFactor);
    }
}
