package com.lendmatch.domain.model;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of a market's state.
 */
@Value
@Builder
public class MarketSnapshot {

    String asset;
    BigInteger reserveFactor;
    BigInteger p2pIndexCursor;
    Indexes indexes;
    Deltas deltas;
    BigInteger idleSupply;
    boolean collateral;
    PauseStatuses pauseStatuses;

    /** Total P2P supply valued in asset units. */
    BigInteger totalP2PSupply;

    /** Total P2P borrow valued in asset units. */
    BigInteger totalP2PBorrow;

    /** P2P fee accrued and not yet settled, asset units. */
    BigInteger accruedFee;

    int poolSuppliers;
    int p2pSuppliers;
    int poolBorrowers;
    int p2pBorrowers;
}
