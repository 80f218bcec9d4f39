package com.lendmatch.domain.model;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * A user's balances in one market, both as stored (scaled) and valued at the market's
 * current indexes (asset units).
 */
@Value
@Builder
public class UserPosition {

    String asset;
    String user;

    BigInteger scaledPoolSupply;
    BigInteger scaledP2PSupply;
    BigInteger scaledPoolBorrow;
    BigInteger scaledP2PBorrow;
    BigInteger scaledCollateral;

    BigInteger supplyBalance;
    BigInteger borrowBalance;
    BigInteger collateralBalance;
}
