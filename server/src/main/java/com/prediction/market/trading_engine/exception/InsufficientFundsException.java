package com.prediction.market.trading_engine.exception;

import com.prediction.market.trading_engine.entity.Money;

public class InsufficientFundsException extends TradeException {

    private final String accountId;
    private final Money required;
    private final Money available;

    public InsufficientFundsException(String accountId, Money required, Money available) {
        super(String.format("Insufficient balance in %s: need %s, have %s", accountId, required, available));
        this.accountId = accountId;
        this.required = required;
        this.available = available;
    }

    public String getAccountId() {
        return accountId;
    }

    public Money getRequired() {
        return required;
    }

    public Money getAvailable() {
        return available;
    }
}
