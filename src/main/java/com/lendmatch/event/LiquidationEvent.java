package com.lendmatch.event;

import java.math.BigInteger;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a successful liquidation.
 */
public class LiquidationEvent extends ApplicationEvent {

    private final String liquidator;
    private final String borrower;
    private final String borrowAsset;
    private final BigInteger repaid;
    private final String collateralAsset;
    private final BigInteger seized;

    public LiquidationEvent(
            Object source,
            String liquidator,
            String borrower,
            String borrowAsset,
            BigInteger repaid,
            String collateralAsset,
            BigInteger seized) {
        super(source);
        this.liquidator = liquidator;
        this.borrower = borrower;
        this.borrowAsset = borrowAsset;
        this.repaid = repaid;
        this.collateralAsset = collateralAsset;
        this.seized = seized;
    }

    public String getLiquidator() {
        return liquidator;
    }

    public String getBorrower() {
        return borrower;
    }

    public String getBorrowAsset() {
        return borrowAsset;
    }

    public BigInteger getRepaid() {
        return repaid;
    }

    public String getCollateralAsset() {
        return collateralAsset;
    }

    public BigInteger getSeized() {
        return seized;
    }
}
