package com.prediction.market.trading_engine.entity;

public enum MarketType {
    PREDICTION,
    PERPETUAL
}
