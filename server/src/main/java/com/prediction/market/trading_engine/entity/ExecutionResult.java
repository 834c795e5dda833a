package com.prediction.market.trading_engine.entity;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * Summary of a decision batch. Failures are collected, never thrown.
 */
@Getter
public class ExecutionResult {

    public record DecisionError(String actorId, TradingDecision decision, String error, boolean retryable) {
    }

    private final int totalDecisions;
    private int successfulTrades;
    private int failedTrades;
    private int holdDecisions;
    private BigDecimal totalVolumePerp = BigDecimal.ZERO;
    private BigDecimal totalVolumePrediction = BigDecimal.ZERO;
    private final List<DecisionError> errors = new ArrayList<>();
    private final List<ExecutedTrade> executedTrades = new ArrayList<>();

    public ExecutionResult(int totalDecisions) {
        this.totalDecisions = totalDecisions;
    }

    public void recordHold() {
        holdDecisions++;
    }

    public void recordSuccess(ExecutedTrade trade) {
        successfulTrades++;
        executedTrades.add(trade);
        if (trade.getMarketType() == MarketType.PERPETUAL) {
            totalVolumePerp = totalVolumePerp.add(trade.getSharesOrSize());
        } else {
            totalVolumePrediction = totalVolumePrediction.add(trade.getAmountCharged());
        }
    }

    public void recordFailure(TradingDecision decision, String error, boolean retryable) {
        failedTrades++;
        errors.add(new DecisionError(decision == null ? null : decision.getActorId(), decision, error, retryable));
    }

    public List<DecisionError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ExecutedTrade> getExecutedTrades() {
        return Collections.unmodifiableList(executedTrades);
    }
}
