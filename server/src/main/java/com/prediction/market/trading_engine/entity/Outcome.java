package com.prediction.market.trading_engine.entity;

/**
 * Side of a binary prediction market.
 */
public enum Outcome {
    YES,
    NO;

    public Outcome opposite() {
        return this == YES ? NO : YES;
    }
}
