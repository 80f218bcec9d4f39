package com.lendmatch.pool;

/**
 * Guard consulted before liquidating users whose health factor sits between the bad-debt
 * threshold and the default threshold, e.g. while a sequencer is down.
 */
public interface LiquidationSentinel {

    boolean isLiquidationAllowed();
}
