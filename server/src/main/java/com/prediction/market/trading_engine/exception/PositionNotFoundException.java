package com.prediction.market.trading_engine.exception;

public class PositionNotFoundException extends TradeException {

    private final String positionId;

    public PositionNotFoundException(String positionId, String reason) {
        super(String.format("Position %s: %s", positionId, reason));
        this.positionId = positionId;
    }

    public String getPositionId() {
        return positionId;
    }
}
