package com.lendmatch.exception;

public class MarketNotCreatedException extends ValidationException {

    public MarketNotCreatedException(String asset) {
        super(
                ValidationReason.MARKET_NOT_CREATED,
                asset,
                null,
                String.format("Market not created for asset: %s", asset));
    }
}
