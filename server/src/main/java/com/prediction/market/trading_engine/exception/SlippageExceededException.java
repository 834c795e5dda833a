package com.prediction.market.trading_engine.exception;

import java.math.BigDecimal;

public class SlippageExceededException extends TradeException {

    private final BigDecimal maxSlippagePercent;
    private final BigDecimal actualSlippagePercent;

    public SlippageExceededException(BigDecimal maxSlippagePercent, BigDecimal actualSlippagePercent) {
        super(String.format("Slippage %s%% exceeds bound %s%%",
                actualSlippagePercent.stripTrailingZeros().toPlainString(),
                maxSlippagePercent.stripTrailingZeros().toPlainString()));
        this.maxSlippagePercent = maxSlippagePercent;
        this.actualSlippagePercent = actualSlippagePercent;
    }

    public BigDecimal getMaxSlippagePercent() {
        return maxSlippagePercent;
    }

    public BigDecimal getActualSlippagePercent() {
        return actualSlippagePercent;
    }
}
