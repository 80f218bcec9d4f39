package com.lendmatch.risk;

import com.lendmatch.core.math.PercentageMath;
import com.lendmatch.domain.model.ReserveConfiguration;
import com.lendmatch.pool.LendingPool;
import com.lendmatch.pool.PriceOracle;
import java.math.BigInteger;
import org.springframework.stereotype.Component;

/**
 * Converts a debt repayment into the collateral a liquidator seizes, applying the
 * collateral's liquidation bonus.
 */
@Component
public class LiquidationCalculator {

    private final LendingPool lendingPool;
    private final PriceOracle priceOracle;

    public LiquidationCalculator(LendingPool lendingPool, PriceOracle priceOracle) {
        this.lendingPool = lendingPool;
        this.priceOracle = priceOracle;
    }

    /**
     * @param maxToRepay        debt the liquidator may repay, borrowed asset units
     * @param collateralBalance borrower's collateral, collateral asset units
     * @return amounts to repay and seize; when the bonus-adjusted seizure would exceed
     *     the collateral, all of it is seized and the repayment scaled down to match
     */
    public SeizeAmounts amountsToSeize(
            String borrowAsset, String collateralAsset, BigInteger maxToRepay, BigInteger collateralBalance) {
        ReserveConfiguration borrowConfiguration = lendingPool.getConfiguration(borrowAsset);
        ReserveConfiguration collateralConfiguration = lendingPool.getConfiguration(collateralAsset);
        BigInteger borrowPrice = priceOracle.getPrice(borrowAsset);
        BigInteger collateralPrice = priceOracle.getPrice(collateralAsset);
        BigInteger bonus = collateralConfiguration.getLiquidationBonus();

        BigInteger seized = PercentageMath.percentMul(
                maxToRepay
                        .multiply(borrowPrice)
                        .multiply(collateralConfiguration.unit())
                        .divide(borrowConfiguration.unit().multiply(collateralPrice)),
                bonus);

        if (seized.compareTo(collateralBalance) <= 0) {
            return new SeizeAmounts(maxToRepay, seized);
        }

        BigInteger repaid = PercentageMath.percentDiv(
                collateralBalance
                        .multiply(collateralPrice)
                        .multiply(borrowConfiguration.unit())
                        .divide(borrowPrice.multiply(collateralConfiguration.unit())),
                bonus);
        return new SeizeAmounts(repaid.min(maxToRepay), collateralBalance);
    }
}
