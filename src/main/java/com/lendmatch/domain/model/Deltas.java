package com.lendmatch.domain.model;

import com.lendmatch.domain.enums.Side;
import lombok.Value;

@Value
public class Deltas {

    public static final Deltas ZERO = new Deltas(MarketSideDelta.ZERO, MarketSideDelta.ZERO);

    MarketSideDelta supply;
    MarketSideDelta borrow;

    public MarketSideDelta get(Side side) {
        return side == Side.SUPPLY ? supply : borrow;
    }

    public Deltas with(Side side, MarketSideDelta delta) {
        return side == Side.SUPPLY ? new Deltas(delta, borrow) : new Deltas(supply, delta);
    }
}
