package com.lendmatch.domain.model;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Where each unit of a processed amount went. The components always add up to
 * {@link #total()}, which equals the amount the flow processed.
 *
 * <ul>
 *   <li>{@code toPool}: supplied to, withdrawn from, borrowed from or repaid to the pool
 *       for the user's own pool position or for broken matches</li>
 *   <li>{@code toP2P}: matched against counterparties promoted from the pool</li>
 *   <li>{@code toDelta}: absorbed by an existing delta</li>
 *   <li>{@code toIdle}: taken from or parked as idle supply</li>
 *   <li>{@code toFee}: settled against the accrued P2P fee</li>
 * </ul>
 */
@Value
@Builder
public class FlowBreakdown {

    @Builder.Default
    BigInteger toPool = BigInteger.ZERO;

    @Builder.Default
    BigInteger toP2P = BigInteger.ZERO;

    @Builder.Default
    BigInteger toDelta = BigInteger.ZERO;

    @Builder.Default
    BigInteger toIdle = BigInteger.ZERO;

    @Builder.Default
    BigInteger toFee = BigInteger.ZERO;

    public BigInteger total() {
        return toPool.add(toP2P).add(toDelta).add(toIdle).add(toFee);
    }
}
