package com.lendmatch.positions;

import com.lendmatch.domain.model.FlowBreakdown;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Bookkeeping outcome of a flow that brings assets in (supply, repay): what the pool
 * must receive and the user's resulting scaled balances.
 */
@Value
@Builder
public class SupplyRepayAccounting {

    /** To repay on the pool for matched or delta volume. */
    BigInteger toRepay;

    /** To supply on the pool. */
    BigInteger toSupply;

    BigInteger onPool;
    BigInteger inP2P;
    FlowBreakdown breakdown;
}
