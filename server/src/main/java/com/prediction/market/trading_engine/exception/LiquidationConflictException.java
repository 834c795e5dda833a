package com.prediction.market.trading_engine.exception;

public class LiquidationConflictException extends TradeException {

    private final String positionId;

    public LiquidationConflictException(String positionId) {
        super(String.format("Position %s was already liquidated", positionId));
        this.positionId = positionId;
    }

    public String getPositionId() {
        return positionId;
    }
}
