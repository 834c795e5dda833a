package com.prediction.market.trading_engine.entity;

/**
 * Perpetual position state machine.
 *
 * State Transitions:
 *
 * OPENING → OPEN        (margin debited, position live)
 * OPEN    → OPEN        (funding tick or price refresh)
 * OPEN    → CLOSED      (explicit close at the index price)
 * OPEN    → LIQUIDATED  (mark price crossed the liquidation price)
 *
 * Terminal states: CLOSED, LIQUIDATED
 */
public enum PerpStatus {

    /**
     * OPENING: Position row built, margin not yet debited.
     * Only ever observed inside the unit of work that opens the position.
     */
    OPENING,

    OPEN,

    /**
     * CLOSED: Settled at the requested (index) price.
     * TERMINAL STATE.
     */
    CLOSED,

    /**
     * LIQUIDATED: Force-closed at the liquidation price.
     * TERMINAL STATE.
     */
    LIQUIDATED;

    public boolean isTerminal() {
        return this == CLOSED || this == LIQUIDATED;
    }

    public boolean canTransitionTo(PerpStatus to) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case OPENING -> to == OPEN;
            case OPEN -> to == OPEN || to == CLOSED || to == LIQUIDATED;
            default -> false;
        };
    }
}
