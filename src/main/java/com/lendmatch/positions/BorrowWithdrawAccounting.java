package com.lendmatch.positions;

import com.lendmatch.domain.model.FlowBreakdown;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Bookkeeping outcome of a flow that sends assets out (borrow, withdraw): what must be
 * taken from the pool and the user's resulting scaled balances.
 */
@Value
@Builder
public class BorrowWithdrawAccounting {

    /** To withdraw from the pool's supply. */
    BigInteger toWithdraw;

    /** To borrow from the pool. */
    BigInteger toBorrow;

    BigInteger onPool;
    BigInteger inP2P;
    FlowBreakdown breakdown;
}
