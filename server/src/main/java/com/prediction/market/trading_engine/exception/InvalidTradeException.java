package com.prediction.market.trading_engine.exception;

/**
 * Trade is well-formed but cannot be priced: it would drive a reserve to zero or below, or round to
 * nothing.
 */
public class InvalidTradeException extends TradeException {

    public InvalidTradeException(String message) {
        super(message);
    }
}
