package com.lendmatch.positions;

import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.FlowBreakdown;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a supply, borrow, repay or withdraw: amount processed, the user's
 * resulting scaled balances, and where the amount went.
 */
@Value
@Builder
public class FlowResult {

    String asset;
    String onBehalf;
    Side side;

    /** Processed amount; for repay and withdraw this is the requested amount capped to the balance. */
    BigInteger amount;

    BigInteger scaledOnPool;
    BigInteger scaledInP2P;
    FlowBreakdown breakdown;
}
