package com.lendmatch.support;

import com.lendmatch.auth.InMemoryPermissionManager;
import com.lendmatch.config.MatchingConfig;
import com.lendmatch.core.accounting.DeltaAccounting;
import com.lendmatch.core.accounting.InterestRatesModel;
import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.core.matching.MatchingEngine;
import com.lendmatch.domain.model.ReserveConfiguration;
import com.lendmatch.domain.model.ReserveIndexes;
import com.lendmatch.event.EventPublisherHelper;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.positions.PositionsAccountant;
import com.lendmatch.positions.PositionsLens;
import com.lendmatch.positions.PositionsManager;
import com.lendmatch.positions.PositionsValidator;
import com.lendmatch.risk.LiquidationCalculator;
import com.lendmatch.risk.LiquidityCalculator;
import com.lendmatch.risk.RiskManager;
import com.lendmatch.risk.RiskParameters;
import com.lendmatch.service.MarketService;
import com.lendmatch.simulator.SimulatedLendingPool;
import com.lendmatch.simulator.SimulatedLiquidationSentinel;
import com.lendmatch.simulator.SimulatedPriceOracle;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Hand-wired lendmatch services on top of the simulated pool, oracle and sentinel,
 * with every published event recorded in {@link #events}.
 *
 * <p>Listed reserves use zero decimals, a price of 1e8, 80% LTV, 85% liquidation
 * threshold and a 5% liquidation bonus unless a test overrides the configuration.
 */
public class LendingStack {

    public static final BigInteger DEFAULT_PRICE = BigInteger.TEN.pow(8);

    public final List<Object> events = new ArrayList<>();

    public final MatchingConfig matchingConfig = new MatchingConfig();
    public final EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(events::add);
    public final Ledger ledger;

    public final SimulatedLendingPool pool = new SimulatedLendingPool();
    public final SimulatedPriceOracle oracle = new SimulatedPriceOracle();
    public final SimulatedLiquidationSentinel sentinel = new SimulatedLiquidationSentinel();
    public final InMemoryPermissionManager permissionManager = new InMemoryPermissionManager();

    public final DeltaAccounting deltaAccounting;
    public final MatchingEngine matchingEngine;
    public final MarketService marketService;
    public final LiquidityCalculator liquidityCalculator;
    public final RiskParameters riskParameters;
    public final RiskManager riskManager;
    public final LiquidationCalculator liquidationCalculator;
    public final PositionsLens lens;
    public final PositionsValidator validator;
    public final PositionsAccountant accountant;
    public final PositionsManager positionsManager;

    public LendingStack() {
        this(4);
    }

    public LendingStack(int maxSortedUsers) {
        matchingConfig.setMaxSortedUsers(maxSortedUsers);
        ledger = new Ledger(eventPublisherHelper, matchingConfig);
        deltaAccounting = new DeltaAccounting(eventPublisherHelper);
        matchingEngine = new MatchingEngine(ledger, eventPublisherHelper);
        marketService = new MarketService(ledger, pool, new InterestRatesModel(), eventPublisherHelper);
        liquidityCalculator = new LiquidityCalculator(ledger, pool, oracle);
        riskParameters = RiskParameters.builder()
                .defaultLiquidationThreshold(WadRayMath.WAD)
                .minLiquidationThreshold(new BigInteger("950000000000000000"))
                .defaultCloseFactor(BigInteger.valueOf(5_000))
                .maxCloseFactor(BigInteger.valueOf(10_000))
                .build();
        riskManager = new RiskManager(ledger, pool, sentinel, liquidityCalculator, riskParameters);
        liquidationCalculator = new LiquidationCalculator(pool, oracle);
        lens = new PositionsLens(ledger, liquidityCalculator, deltaAccounting);
        validator = new PositionsValidator(ledger, permissionManager);
        accountant = new PositionsAccountant(ledger, deltaAccounting, matchingEngine, pool);
        positionsManager = new PositionsManager(
                ledger,
                validator,
                accountant,
                lens,
                marketService,
                riskManager,
                liquidationCalculator,
                pool,
                eventPublisherHelper,
                matchingConfig);
    }

    public static ReserveConfiguration defaultReserve() {
        return ReserveConfiguration.builder()
                .borrowingEnabled(true)
                .ltv(BigInteger.valueOf(8_000))
                .liquidationThreshold(BigInteger.valueOf(8_500))
                .liquidationBonus(BigInteger.valueOf(10_500))
                .build();
    }

    public static ReserveIndexes indexes(BigInteger supplyIndex, BigInteger borrowIndex) {
        return new ReserveIndexes(supplyIndex, borrowIndex);
    }

    /** Lists {@code asset} on the pool at RAY indexes and creates its market. */
    public void listMarket(String asset) {
        listMarket(asset, defaultReserve());
    }

    public void listMarket(String asset, ReserveConfiguration configuration) {
        pool.listReserve(asset, configuration, indexes(WadRayMath.RAY, WadRayMath.RAY));
        oracle.setPrice(asset, DEFAULT_PRICE);
        marketService.createMarket(asset, BigInteger.ZERO, BigInteger.valueOf(5_000));
    }

    /** Lists {@code asset} and allows it as collateral. */
    public void listCollateralMarket(String asset) {
        listMarket(asset);
        marketService.setIsCollateral(asset, true);
    }

    public <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    public static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }
}
