package com.lendmatch.service;

import com.lendmatch.core.accounting.InterestRatesModel;
import com.lendmatch.core.math.PercentageMath;
import com.lendmatch.domain.Addresses;
import com.lendmatch.domain.enums.MarketAction;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.domain.model.MarketSideIndexes;
import com.lendmatch.domain.model.PauseStatuses;
import com.lendmatch.domain.model.ReserveIndexes;
import com.lendmatch.event.EventPublisherHelper;
import com.lendmatch.event.MarketEventType;
import com.lendmatch.exception.PolicyException;
import com.lendmatch.exception.PolicyReason;
import com.lendmatch.exception.ValidationException;
import com.lendmatch.exception.ValidationReason;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.ledger.Market;
import com.lendmatch.pool.LendingPool;
import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Market lifecycle: creation, operator switches and index refresh.
 *
 * <p>Every mutating method runs as its own ledger transaction and publishes a
 * {@link com.lendmatch.event.MarketEvent} once committed. Markets are never removed.
 */
@Service
public class MarketService {

    private static final Logger log = LoggerFactory.getLogger(MarketService.class);

    private final Ledger ledger;
    private final LendingPool lendingPool;
    private final InterestRatesModel interestRatesModel;
    private final EventPublisherHelper eventPublisherHelper;

    public MarketService(
            Ledger ledger,
            LendingPool lendingPool,
            InterestRatesModel interestRatesModel,
            EventPublisherHelper eventPublisherHelper) {
        this.ledger = ledger;
        this.lendingPool = lendingPool;
        this.interestRatesModel = interestRatesModel;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // CREATION
    // ========================

    /**
     * Lists {@code asset}. Idempotent: a second call returns the existing market
     * untouched, whatever parameters it carries.
     *
     * @param reserveFactor  share of the P2P spread kept by the protocol, basis points
     * @param p2pIndexCursor position of the P2P rate between the pool rates, basis points
     */
    public Market createMarket(String asset, BigInteger reserveFactor, BigInteger p2pIndexCursor) {
        if (Addresses.isZero(asset)) {
            throw new ValidationException(ValidationReason.ADDRESS_IS_ZERO, "Asset address is zero");
        }
        if (!PercentageMath.isValid(reserveFactor) || !PercentageMath.isValid(p2pIndexCursor)) {
            throw new ValidationException(
                    ValidationReason.INVALID_PERCENTAGE, "Reserve factor and P2P index cursor must be within 0-10000");
        }

        return ledger.execute("createMarket", () -> {
            if (ledger.isCreated(asset)) {
                return ledger.getMarket(asset);
            }
            ReserveIndexes poolIndexes = lendingPool.getReserveIndexes(asset);
            Indexes indexes = new Indexes(
                    MarketSideIndexes.initial(poolIndexes.getPoolSupplyIndex()),
                    MarketSideIndexes.initial(poolIndexes.getPoolBorrowIndex()));
            Market market = ledger.createMarket(asset, reserveFactor, p2pIndexCursor, indexes);

            eventPublisherHelper.publishMarketEvent(
                    this,
                    asset,
                    MarketEventType.CREATED,
                    Map.of("reserveFactor", reserveFactor, "p2pIndexCursor", p2pIndexCursor));
            log.info("Market created: {} (reserveFactor={}, p2pIndexCursor={})", asset, reserveFactor, p2pIndexCursor);
            return market;
        });
    }

    // ========================
    // OPERATOR SWITCHES
    // ========================

    public Market setPauseStatus(String asset, MarketAction action, boolean paused) {
        return updateStatuses("setPauseStatus", asset, statuses -> {
            if (action == MarketAction.BORROW && !paused && statuses.isDeprecated()) {
                throw new PolicyException(PolicyReason.MARKET_DEPRECATED, asset);
            }
            return statuses.withPaused(action, paused);
        });
    }

    /** Pauses or unpauses every user action of the market at once. */
    public Market setIsPaused(String asset, boolean paused) {
        return updateStatuses("setIsPaused", asset, statuses -> {
            if (!paused && statuses.isDeprecated()) {
                throw new PolicyException(PolicyReason.MARKET_DEPRECATED, asset);
            }
            return statuses.withAllPaused(paused);
        });
    }

    public Market setIsP2PDisabled(String asset, boolean disabled) {
        return updateStatuses("setIsP2PDisabled", asset, statuses -> statuses.withP2PDisabled(disabled));
    }

    /**
     * Deprecating a market opens all its borrowers to full liquidation, so it is only
     * allowed once borrowing is paused.
     */
    public Market setIsDeprecated(String asset, boolean deprecated) {
        return updateStatuses("setIsDeprecated", asset, statuses -> {
            if (deprecated && !statuses.isBorrowPaused()) {
                throw new PolicyException(PolicyReason.DEPRECATION_REQUIRES_BORROW_PAUSE, asset);
            }
            return statuses.withDeprecated(deprecated);
        });
    }

    public Market setIsCollateral(String asset, boolean isCollateral) {
        return ledger.execute("setIsCollateral", () -> {
            Market market = ledger.getMarket(asset);
            market.setCollateral(isCollateral);
            eventPublisherHelper.publishMarketEvent(
                    this, asset, MarketEventType.COLLATERAL_STATUS_SET, Map.of("isCollateral", isCollateral));
            log.info("Market {} collateral status set to {}", asset, isCollateral);
            return market;
        });
    }

    private Market updateStatuses(String operation, String asset, UnaryOperator<PauseStatuses> change) {
        return ledger.execute(operation, () -> {
            Market market = ledger.getMarket(asset);
            PauseStatuses updated = change.apply(market.getPauseStatuses());
            market.setPauseStatuses(updated);
            eventPublisherHelper.publishMarketEvent(
                    this, asset, MarketEventType.PAUSE_STATUS_SET, Map.of("pauseStatuses", updated));
            log.info("Market {} {}: {}", asset, operation, updated);
            return market;
        });
    }

    // ========================
    // INDEXES
    // ========================

    /**
     * Brings the market's indexes up to the pool's current ones.
     *
     * @throws com.lendmatch.exception.MarketNotCreatedException if the asset has no market
     */
    public Market updateIndexes(String asset) {
        return ledger.execute("updateIndexes", () -> {
            Market market = ledger.getMarket(asset);
            Indexes updated = interestRatesModel.computeIndexes(market, lendingPool.getReserveIndexes(asset));
            if (!updated.equals(market.getIndexes())) {
                market.setIndexes(updated);
                eventPublisherHelper.publishMarketEvent(
                        this,
                        asset,
                        MarketEventType.INDEXES_UPDATED,
                        Map.of(
                                "poolSupplyIndex", updated.getSupply().getPoolIndex(),
                                "p2pSupplyIndex", updated.getSupply().getP2pIndex(),
                                "poolBorrowIndex", updated.getBorrow().getPoolIndex(),
                                "p2pBorrowIndex", updated.getBorrow().getP2pIndex()));
            }
            return market;
        });
    }

    /** Refreshes every market the user has collateral or debt in. */
    public void updateIndexesForUser(String user) {
        ledger.execute("updateIndexesForUser", () -> {
            Set<String> assets = new LinkedHashSet<>(ledger.getUserCollaterals(user));
            assets.addAll(ledger.getUserBorrows(user));
            assets.forEach(this::updateIndexes);
            return assets.size();
        });
    }
}
