package com.prediction.market.trading_engine.entity;

import java.util.Arrays;
import java.util.Locale;

import com.prediction.market.trading_engine.exception.ValidationException;

/**
 * Actions a decision producer can request. Wire names match what NPC and UI producers emit.
 */
public enum TradeAction {
    BUY_YES("buy_yes"),
    BUY_NO("buy_no"),
    SELL("sell"),
    CLOSE_POSITION("close_position"),
    OPEN_LONG("open_long"),
    OPEN_SHORT("open_short"),
    CLOSE_PERP("close_perp"),
    HOLD("hold");

    private final String wireName;

    TradeAction(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static TradeAction fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("action is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(action -> action.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown action: " + name));
    }
}
