package com.prediction.market.trading_engine.exception;

public class MarketClosedException extends TradeException {

    private final String marketId;

    public MarketClosedException(String marketId, String reason) {
        super(String.format("Market %s is closed: %s", marketId, reason));
        this.marketId = marketId;
    }

    public String getMarketId() {
        return marketId;
    }
}
