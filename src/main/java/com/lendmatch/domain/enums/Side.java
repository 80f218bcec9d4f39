package com.lendmatch.domain.enums;

/**
 * One side of a market: suppliers lend the asset, borrowers owe it.
 */
public enum Side {
    SUPPLY,
    BORROW;

    public Side opposite() {
        return this == SUPPLY ? BORROW : SUPPLY;
    }
}
