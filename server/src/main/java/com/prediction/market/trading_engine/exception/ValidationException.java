package com.prediction.market.trading_engine.exception;

/**
 * Malformed decision: missing fields, non-positive amount, unknown side or action, leverage out of range.
 */
public class ValidationException extends TradeException {

    public ValidationException(String message) {
        super(message);
    }
}
