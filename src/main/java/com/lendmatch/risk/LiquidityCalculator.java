package com.lendmatch.risk;

import com.lendmatch.core.math.PercentageMath;
import com.lendmatch.core.math.ScaledMath;
import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.domain.model.LiquidityData;
import com.lendmatch.domain.model.ReserveConfiguration;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.ledger.MarketBalances;
import com.lendmatch.pool.LendingPool;
import com.lendmatch.pool.PriceOracle;
import java.math.BigInteger;
import org.springframework.stereotype.Component;

/**
 * Values a user's collateral and debt in the oracle's base currency at the markets'
 * stored indexes.
 *
 * <p>Collateral is rounded down and shaved by one basis point of liquidation
 * threshold ({@code 1 / LT_LOWER_BOUND}), debt is rounded up, so the health factor
 * errs against the user.
 */
@Component
public class LiquidityCalculator {

    /** Smallest liquidation-threshold step the pool can express. */
    static final BigInteger LT_LOWER_BOUND = BigInteger.valueOf(10_000);

    private final Ledger ledger;
    private final LendingPool lendingPool;
    private final PriceOracle priceOracle;

    public LiquidityCalculator(Ledger ledger, LendingPool lendingPool, PriceOracle priceOracle) {
        this.ledger = ledger;
        this.lendingPool = lendingPool;
        this.priceOracle = priceOracle;
    }

    public LiquidityData liquidityData(String user) {
        BigInteger borrowable = BigInteger.ZERO;
        BigInteger maxDebt = BigInteger.ZERO;
        for (String asset : ledger.getUserCollaterals(user)) {
            ReserveConfiguration configuration = lendingPool.getConfiguration(asset);
            BigInteger collateralValue = collateralValue(asset, user, configuration);
            borrowable = borrowable.add(PercentageMath.percentMulDown(collateralValue, configuration.getLtv()));
            maxDebt = maxDebt.add(
                    PercentageMath.percentMulDown(collateralValue, configuration.getLiquidationThreshold()));
        }

        BigInteger debt = BigInteger.ZERO;
        for (String asset : ledger.getUserBorrows(user)) {
            debt = debt.add(debtValue(asset, user));
        }

        return LiquidityData.builder()
                .borrowable(borrowable)
                .maxDebt(maxDebt)
                .debt(debt)
                .build();
    }

    public BigInteger healthFactor(String user) {
        return liquidityData(user).healthFactor();
    }

    private BigInteger collateralValue(String asset, String user, ReserveConfiguration configuration) {
        MarketBalances balances = ledger.getBalances(asset);
        BigInteger poolSupplyIndex = ledger.getMarket(asset).getIndexes().getSupply().getPoolIndex();
        BigInteger collateral =
                ScaledMath.value(balances.scaledCollateralBalance(user), poolSupplyIndex, Side.SUPPLY);

        BigInteger raw = collateral.multiply(priceOracle.getPrice(asset)).divide(configuration.unit());
        return raw.multiply(LT_LOWER_BOUND.subtract(BigInteger.ONE)).divide(LT_LOWER_BOUND);
    }

    private BigInteger debtValue(String asset, String user) {
        MarketBalances balances = ledger.getBalances(asset);
        Indexes indexes = ledger.getMarket(asset).getIndexes();
        BigInteger debt = ScaledMath.value(
                        balances.scaledPoolBorrowBalance(user), indexes.getBorrow().getPoolIndex(), Side.BORROW)
                .add(ScaledMath.value(
                        balances.scaledP2PBorrowBalance(user), indexes.getBorrow().getP2pIndex(), Side.BORROW));
        BigInteger unit = lendingPool.getConfiguration(asset).unit();
        return WadRayMath.divUp(debt.multiply(priceOracle.getPrice(asset)), unit);
    }
}
