package com.prediction.market.trading_engine.entity;

public enum PerpSide {
    LONG,
    SHORT;

    public boolean isLong() {
        return this == LONG;
    }
}
