package com.lendmatch.positions;

import java.math.BigInteger;
import lombok.Value;

@Value
public class CollateralResult {

    String asset;
    String onBehalf;
    BigInteger amount;
    BigInteger scaledCollateral;
}
