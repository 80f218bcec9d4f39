package com.lendmatch.positions;

import com.lendmatch.domain.model.FlowBreakdown;
import com.lendmatch.risk.LiquidationRegime;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LiquidationResult {

    String liquidator;
    String borrower;
    String borrowAsset;
    String collateralAsset;
    BigInteger repaid;
    BigInteger seized;
    LiquidationRegime regime;
    BigInteger closeFactor;
    FlowBreakdown repayBreakdown;
}
