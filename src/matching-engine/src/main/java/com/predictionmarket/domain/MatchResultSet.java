package com.predictionmarket.domain;

import java.util.List;

/**
 * Collection of trades for one incoming order, in execution order.
 */
public class MatchResultSet {

    private final List<Trade> trades;
    private final long totalFilledQuantity;
    private final boolean incomingFullyFilled;

    public MatchResultSet(List<Trade> trades, long totalFilledQuantity,
                          boolean incomingFullyFilled) {
        this.trades = List.copyOf(trades);
        this.totalFilledQuantity = totalFilledQuantity;
        this.incomingFullyFilled = incomingFullyFilled;
    }

    public List<Trade> getTrades() {
        return trades;
    }

    public long getTotalFilledQuantity() {
        return totalFilledQuantity;
    }

    public boolean isIncomingFullyFilled() {
        return incomingFullyFilled;
    }

    public int getTradeCount() {
        return trades.size();
    }

    public boolean hasTrades() {
        return !trades.isEmpty();
    }
}
