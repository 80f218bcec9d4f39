package com.lendmatch.positions;

import com.lendmatch.config.MatchingConfig;
import com.lendmatch.core.math.PercentageMath;
import com.lendmatch.domain.Addresses;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.event.EventPublisherHelper;
import com.lendmatch.event.PositionEvent;
import com.lendmatch.event.PositionEventType;
import com.lendmatch.exception.ValidationException;
import com.lendmatch.exception.ValidationReason;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.pool.LendingPool;
import com.lendmatch.risk.LiquidationAuthorization;
import com.lendmatch.risk.LiquidationCalculator;
import com.lendmatch.risk.RiskManager;
import com.lendmatch.risk.SeizeAmounts;
import com.lendmatch.service.MarketService;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of every user operation on positions.
 *
 * <p>Each operation is one ledger transaction running, in order:
 * <ol>
 *   <li>validation, policy and permission checks ({@link PositionsValidator})</li>
 *   <li>index refresh of the markets involved</li>
 *   <li>bookkeeping ({@link PositionsAccountant})</li>
 *   <li>post-accounting risk checks for borrow and collateral withdrawal</li>
 *   <li>event emission (delivered on commit)</li>
 *   <li>pool calls, last, once no bookkeeping is left</li>
 * </ol>
 *
 * <p>Any exception, including one raised by the pool, rolls the whole operation back;
 * pool calls already made in it are reversed by their compensating call.
 * {@code caller} is the acting address; {@code onBehalf} owns the position.
 */
@Service
public class PositionsManager {

    private static final Logger log = LoggerFactory.getLogger(PositionsManager.class);

    private final Ledger ledger;
    private final PositionsValidator positionsValidator;
    private final PositionsAccountant positionsAccountant;
    private final PositionsLens positionsLens;
    private final MarketService marketService;
    private final RiskManager riskManager;
    private final LiquidationCalculator liquidationCalculator;
    private final LendingPool lendingPool;
    private final EventPublisherHelper eventPublisherHelper;
    private final MatchingConfig matchingConfig;

    public PositionsManager(
            Ledger ledger,
            PositionsValidator positionsValidator,
            PositionsAccountant positionsAccountant,
            PositionsLens positionsLens,
            MarketService marketService,
            RiskManager riskManager,
            LiquidationCalculator liquidationCalculator,
            LendingPool lendingPool,
            EventPublisherHelper eventPublisherHelper,
            MatchingConfig matchingConfig) {
        this.ledger = ledger;
        this.positionsValidator = positionsValidator;
        this.positionsAccountant = positionsAccountant;
        this.positionsLens = positionsLens;
        this.marketService = marketService;
        this.riskManager = riskManager;
        this.liquidationCalculator = liquidationCalculator;
        this.lendingPool = lendingPool;
        this.eventPublisherHelper = eventPublisherHelper;
        this.matchingConfig = matchingConfig;
    }

    // ========================
    // SUPPLY
    // ========================

    public FlowResult supply(String caller, String asset, BigInteger amount, String onBehalf, int maxLoops) {
        return ledger.execute("supply", () -> {
            positionsValidator.validateSupply(asset, amount, onBehalf);
            positionsValidator.validateMaxLoops(maxLoops);
            marketService.updateIndexes(asset);

            SupplyRepayAccounting accounting = positionsAccountant.accountSupply(asset, amount, onBehalf, maxLoops);

            publishFlowEvent(PositionEventType.SUPPLIED, Side.SUPPLY, caller, onBehalf, null, asset, amount, accounting);
            repayAndSupplyOnPool(asset, accounting);

            log.debug("{} supplied {} {} for {}", caller, amount, asset, onBehalf);
            return flowResult(asset, onBehalf, Side.SUPPLY, amount, accounting);
        });
    }

    public CollateralResult supplyCollateral(String caller, String asset, BigInteger amount, String onBehalf) {
        return ledger.execute("supplyCollateral", () -> {
            positionsValidator.validateSupplyCollateral(asset, amount, onBehalf);
            marketService.updateIndexes(asset);

            BigInteger collateral = positionsAccountant.accountSupplyCollateral(asset, amount, onBehalf);

            publishCollateralEvent(
                    PositionEventType.COLLATERAL_SUPPLIED, caller, onBehalf, null, asset, amount, collateral);
            supplyOnPool(asset, amount);

            log.debug("{} supplied {} {} as collateral for {}", caller, amount, asset, onBehalf);
            return new CollateralResult(asset, onBehalf, amount, collateral);
        });
    }

    // ========================
    // BORROW
    // ========================

    public FlowResult borrow(
            String caller, String asset, BigInteger amount, String onBehalf, String receiver, int maxLoops) {
        return ledger.execute("borrow", () -> {
            positionsValidator.validateBorrow(asset, amount, onBehalf, receiver);
            riskManager.validateBorrowPolicy(asset, amount);
            positionsValidator.validateManager(caller, onBehalf);
            positionsValidator.validateMaxLoops(maxLoops);
            marketService.updateIndexes(asset);
            marketService.updateIndexesForUser(onBehalf);

            BorrowWithdrawAccounting accounting = positionsAccountant.accountBorrow(asset, amount, onBehalf, maxLoops);
            riskManager.authorizeBorrow(onBehalf);

            publishFlowEvent(
                    PositionEventType.BORROWED, Side.BORROW, caller, onBehalf, receiver, asset, amount, accounting);
            withdrawAndBorrowOnPool(asset, accounting);

            log.debug("{} borrowed {} {} for {} to {}", caller, amount, asset, onBehalf, receiver);
            return flowResult(asset, onBehalf, Side.BORROW, amount, accounting);
        });
    }

    // ========================
    // REPAY
    // ========================

    /**
     * Repays up to {@code amount}; anything above the outstanding debt is not taken.
     */
    public FlowResult repay(String caller, String asset, BigInteger amount, String onBehalf, int maxLoops) {
        return ledger.execute("repay", () -> {
            positionsValidator.validateRepay(asset, amount, onBehalf);
            positionsValidator.validateMaxLoops(maxLoops);
            marketService.updateIndexes(asset);

            BigInteger toProcess = positionsLens.borrowBalance(asset, onBehalf).min(amount);
            if (toProcess.signum() == 0) {
                throw new ValidationException(
                        ValidationReason.DEBT_IS_ZERO, asset, onBehalf, onBehalf + " has no debt in " + asset);
            }

            SupplyRepayAccounting accounting =
                    positionsAccountant.accountRepay(asset, toProcess, onBehalf, maxLoops);

            publishFlowEvent(
                    PositionEventType.REPAID, Side.BORROW, caller, onBehalf, null, asset, toProcess, accounting);
            repayAndSupplyOnPool(asset, accounting);

            log.debug("{} repaid {} {} for {}", caller, toProcess, asset, onBehalf);
            return flowResult(asset, onBehalf, Side.BORROW, toProcess, accounting);
        });
    }

    // ========================
    // WITHDRAW
    // ========================

    /**
     * Withdraws up to {@code amount}; anything above the supplied balance is not taken.
     */
    public FlowResult withdraw(
            String caller, String asset, BigInteger amount, String onBehalf, String receiver, int maxLoops) {
        return ledger.execute("withdraw", () -> {
            positionsValidator.validateWithdraw(asset, amount, onBehalf, receiver);
            positionsValidator.validateManager(caller, onBehalf);
            positionsValidator.validateMaxLoops(maxLoops);
            marketService.updateIndexes(asset);

            BigInteger toProcess = positionsLens.supplyBalance(asset, onBehalf).min(amount);
            if (toProcess.signum() == 0) {
                throw new ValidationException(
                        ValidationReason.SUPPLY_IS_ZERO, asset, onBehalf, onBehalf + " has no supply in " + asset);
            }

            BorrowWithdrawAccounting accounting =
                    positionsAccountant.accountWithdraw(asset, toProcess, onBehalf, maxLoops);

            publishFlowEvent(
                    PositionEventType.WITHDRAWN, Side.SUPPLY, caller, onBehalf, receiver, asset, toProcess, accounting);
            withdrawAndBorrowOnPool(asset, accounting);

            log.debug("{} withdrew {} {} for {} to {}", caller, toProcess, asset, onBehalf, receiver);
            return flowResult(asset, onBehalf, Side.SUPPLY, toProcess, accounting);
        });
    }

    public CollateralResult withdrawCollateral(
            String caller, String asset, BigInteger amount, String onBehalf, String receiver) {
        return ledger.execute("withdrawCollateral", () -> {
            positionsValidator.validateWithdrawCollateral(asset, amount, onBehalf, receiver);
            positionsValidator.validateManager(caller, onBehalf);
            marketService.updateIndexes(asset);
            marketService.updateIndexesForUser(onBehalf);

            BigInteger toProcess = positionsLens.collateralBalance(asset, onBehalf).min(amount);
            if (toProcess.signum() == 0) {
                throw new ValidationException(
                        ValidationReason.COLLATERAL_IS_ZERO,
                        asset,
                        onBehalf,
                        onBehalf + " has no collateral in " + asset);
            }

            BigInteger collateral = positionsAccountant.accountWithdrawCollateral(asset, toProcess, onBehalf);
            riskManager.authorizeWithdrawCollateral(onBehalf);

            publishCollateralEvent(
                    PositionEventType.COLLATERAL_WITHDRAWN, caller, onBehalf, receiver, asset, toProcess, collateral);
            withdrawFromPool(asset, toProcess);

            log.debug("{} withdrew {} {} of collateral for {} to {}", caller, toProcess, asset, onBehalf, receiver);
            return new CollateralResult(asset, onBehalf, toProcess, collateral);
        });
    }

    // ========================
    // LIQUIDATION
    // ========================

    /**
     * Repays part of an unhealthy borrower's debt in {@code borrowAsset} and hands the
     * liquidator the matching collateral in {@code collateralAsset}, plus bonus.
     */
    public LiquidationResult liquidate(
            String caller, String borrowAsset, String collateralAsset, String borrower, BigInteger maxDebtToCover) {
        return ledger.execute("liquidate", () -> {
            if (maxDebtToCover == null || maxDebtToCover.signum() <= 0) {
                throw new ValidationException(ValidationReason.AMOUNT_IS_ZERO, "Amount must be positive");
            }
            if (Addresses.isZero(borrower)) {
                throw new ValidationException(ValidationReason.ADDRESS_IS_ZERO, "Borrower address is zero");
            }
            if (Addresses.isZero(caller)) {
                throw new ValidationException(ValidationReason.ADDRESS_IS_ZERO, "Liquidator address is zero");
            }
            ledger.getMarket(collateralAsset);
            ledger.getMarket(borrowAsset);
            marketService.updateIndexes(borrowAsset);
            marketService.updateIndexes(collateralAsset);
            marketService.updateIndexesForUser(borrower);

            LiquidationAuthorization authorization =
                    riskManager.authorizeLiquidate(borrowAsset, collateralAsset, borrower);

            BigInteger repayable = PercentageMath.percentMul(
                            positionsLens.borrowBalance(borrowAsset, borrower), authorization.getCloseFactor())
                    .min(maxDebtToCover);
            SeizeAmounts amounts = liquidationCalculator.amountsToSeize(
                    borrowAsset,
                    collateralAsset,
                    repayable,
                    positionsLens.collateralBalance(collateralAsset, borrower));
            if (amounts.getRepaid().signum() == 0) {
                throw new ValidationException(ValidationReason.AMOUNT_IS_ZERO, "Nothing to liquidate");
            }

            SupplyRepayAccounting repay = positionsAccountant.accountRepay(
                    borrowAsset, amounts.getRepaid(), borrower, matchingConfig.getDefaultIterations().getRepay());
            BigInteger collateral =
                    positionsAccountant.accountWithdrawCollateral(collateralAsset, amounts.getSeized(), borrower);

            publishFlowEvent(
                    PositionEventType.REPAID,
                    Side.BORROW,
                    caller,
                    borrower,
                    null,
                    borrowAsset,
                    amounts.getRepaid(),
                    repay);
            publishCollateralEvent(
                    PositionEventType.COLLATERAL_WITHDRAWN,
                    caller,
                    borrower,
                    caller,
                    collateralAsset,
                    amounts.getSeized(),
                    collateral);
            eventPublisherHelper.publishLiquidated(
                    this, caller, borrower, borrowAsset, amounts.getRepaid(), collateralAsset, amounts.getSeized());

            repayAndSupplyOnPool(borrowAsset, repay);
            withdrawFromPool(collateralAsset, amounts.getSeized());

            log.info(
                    "{} liquidated {}: repaid {} {}, seized {} {} ({})",
                    caller,
                    borrower,
                    amounts.getRepaid(),
                    borrowAsset,
                    amounts.getSeized(),
                    collateralAsset,
                    authorization.getRegime());
            return LiquidationResult.builder()
                    .liquidator(caller)
                    .borrower(borrower)
                    .borrowAsset(borrowAsset)
                    .collateralAsset(collateralAsset)
                    .repaid(amounts.getRepaid())
                    .seized(amounts.getSeized())
                    .regime(authorization.getRegime())
                    .closeFactor(authorization.getCloseFactor())
                    .repayBreakdown(repay.getBreakdown())
                    .build();
        });
    }

    // ========================
    // POOL CALLS
    // ========================

    private void repayAndSupplyOnPool(String asset, SupplyRepayAccounting accounting) {
        if (accounting.getToRepay().signum() > 0) {
            repayOnPool(asset, accounting.getToRepay());
        }
        if (accounting.getToSupply().signum() > 0) {
            supplyOnPool(asset, accounting.getToSupply());
        }
    }

    private void withdrawAndBorrowOnPool(String asset, BorrowWithdrawAccounting accounting) {
        if (accounting.getToWithdraw().signum() > 0) {
            withdrawFromPool(asset, accounting.getToWithdraw());
        }
        if (accounting.getToBorrow().signum() > 0) {
            borrowOnPool(asset, accounting.getToBorrow());
        }
    }

    // Every successful pool call registers its inverse, so a later failure in the same
    // operation leaves the pool as it was.

    private void supplyOnPool(String asset, BigInteger amount) {
        lendingPool.supply(asset, amount);
        ledger.onRollback("pool supply " + amount + " " + asset, () -> lendingPool.withdraw(asset, amount));
    }

    private void withdrawFromPool(String asset, BigInteger amount) {
        lendingPool.withdraw(asset, amount);
        ledger.onRollback("pool withdraw " + amount + " " + asset, () -> lendingPool.supply(asset, amount));
    }

    private void borrowOnPool(String asset, BigInteger amount) {
        lendingPool.borrow(asset, amount);
        ledger.onRollback("pool borrow " + amount + " " + asset, () -> lendingPool.repay(asset, amount));
    }

    private void repayOnPool(String asset, BigInteger amount) {
        lendingPool.repay(asset, amount);
        ledger.onRollback("pool repay " + amount + " " + asset, () -> lendingPool.borrow(asset, amount));
    }

    // ========================
    // EVENTS & RESULTS
    // ========================

    private void publishFlowEvent(
            PositionEventType type,
            Side side,
            String caller,
            String onBehalf,
            String receiver,
            String asset,
            BigInteger amount,
            SupplyRepayAccounting accounting) {
        publishFlowEvent(
                type, side, caller, onBehalf, receiver, asset, amount, accounting.getOnPool(), accounting.getInP2P());
    }

    private void publishFlowEvent(
            PositionEventType type,
            Side side,
            String caller,
            String onBehalf,
            String receiver,
            String asset,
            BigInteger amount,
            BorrowWithdrawAccounting accounting) {
        publishFlowEvent(
                type, side, caller, onBehalf, receiver, asset, amount, accounting.getOnPool(), accounting.getInP2P());
    }

    private void publishFlowEvent(
            PositionEventType type,
            Side side,
            String caller,
            String onBehalf,
            String receiver,
            String asset,
            BigInteger amount,
            BigInteger onPool,
            BigInteger inP2P) {
        eventPublisherHelper.publishPositionEvent(PositionEvent.builder()
                .source(this)
                .eventType(type)
                .side(side)
                .actor(caller)
                .onBehalf(onBehalf)
                .receiver(receiver)
                .asset(asset)
                .amount(amount)
                .scaledOnPool(onPool)
                .scaledInP2P(inP2P)
                .build());
    }

    private void publishCollateralEvent(
            PositionEventType type,
            String caller,
            String onBehalf,
            String receiver,
            String asset,
            BigInteger amount,
            BigInteger scaledCollateral) {
        eventPublisherHelper.publishPositionEvent(PositionEvent.builder()
                .source(this)
                .eventType(type)
                .side(Side.SUPPLY)
                .actor(caller)
                .onBehalf(onBehalf)
                .receiver(receiver)
                .asset(asset)
                .amount(amount)
                .scaledCollateral(scaledCollateral)
                .build());
    }

    private FlowResult flowResult(
            String asset, String onBehalf, Side side, BigInteger amount, SupplyRepayAccounting accounting) {
        return FlowResult.builder()
                .asset(asset)
                .onBehalf(onBehalf)
                .side(side)
                .amount(amount)
                .scaledOnPool(accounting.getOnPool())
                .scaledInP2P(accounting.getInP2P())
                .breakdown(accounting.getBreakdown())
                .build();
    }

    private FlowResult flowResult(
            String asset, String onBehalf, Side side, BigInteger amount, BorrowWithdrawAccounting accounting) {
        return FlowResult.builder()
                .asset(asset)
                .onBehalf(onBehalf)
                .side(side)
                .amount(amount)
                .scaledOnPool(accounting.getOnPool())
                .scaledInP2P(accounting.getInP2P())
                .breakdown(accounting.getBreakdown())
                .build();
    }
}
