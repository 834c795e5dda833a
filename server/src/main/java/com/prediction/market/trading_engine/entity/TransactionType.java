package com.prediction.market.trading_engine.entity;

/**
 * Ledger transaction categories. The sign of a row's amount is carried by the row, not the type.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    PREDICTION_BUY,
    PREDICTION_SELL,
    PREDICTION_PAYOUT,
    PERP_OPEN,
    PERP_CLOSE,
    PERP_LIQUIDATION,
    PERP_FUNDING
}
