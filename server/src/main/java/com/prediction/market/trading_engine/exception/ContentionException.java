package com.prediction.market.trading_engine.exception;

/**
 * Another unit of work held (or won the race for) the same market, position or pool.
 * Callers should retry with backoff.
 */
public class ContentionException extends TradeException {

    private final String resourceKey;

    public ContentionException(String resourceKey, String message) {
        super(message);
        this.resourceKey = resourceKey;
    }

    public ContentionException(String resourceKey, String message, Throwable cause) {
        super(message, cause);
        this.resourceKey = resourceKey;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
