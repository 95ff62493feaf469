package com.predictionmarket.domain;

import java.util.List;

/**
 * Result returned to the submitter of an order.
 */
public class OrderPlacement {

    private final long orderId;
    private final OrderStatus status;
    private final long filledQuantity;
    private final long remainingQuantity;
    private final List<Trade> trades;

    public OrderPlacement(long orderId, OrderStatus status, long filledQuantity,
                          long remainingQuantity, List<Trade> trades) {
        this.orderId = orderId;
        this.status = status;
        this.filledQuantity = filledQuantity;
        this.remainingQuantity = remainingQuantity;
        this.trades = List.copyOf(trades);
    }

    /**
     * Human-readable summary, e.g. "Order 7: PARTIALLY_FILLED. Filled 5/10 shares in 2 trade(s)."
     */
    public String getMessage() {
        return "Order " + orderId + ": " + status + ". Filled " + filledQuantity + "/"
                + (filledQuantity + remainingQuantity) + " shares in " + trades.size()
                + " trade(s).";
    }

    public long getOrderId() {
        return orderId;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public long getFilledQuantity() {
        return filledQuantity;
    }

    public long getRemainingQuantity() {
        return remainingQuantity;
    }

    public List<Trade> getTrades() {
        return trades;
    }
}
