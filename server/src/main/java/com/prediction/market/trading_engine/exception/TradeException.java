package com.prediction.market.trading_engine.exception;

/**
 * Base type for every failure the engine reports to a decision producer.
 * Only {@link ContentionException} is worth retrying; everything else describes a decision that will
 * keep failing until it is changed.
 */
public abstract class TradeException extends RuntimeException {

    protected TradeException(String message) {
        super(message);
    }

    protected TradeException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
