package com.lendmatch.domain.model;

import com.lendmatch.domain.enums.Side;
import lombok.Value;

@Value
public class Indexes {

    MarketSideIndexes supply;
    MarketSideIndexes borrow;

    public MarketSideIndexes get(Side side) {
        return side == Side.SUPPLY ? supply : borrow;
    }
}
