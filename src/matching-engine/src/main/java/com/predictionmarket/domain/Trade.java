package com.predictionmarket.domain;

/**
 * A single execution between a taker (incoming) order and a maker (resting)
 * order. Immutable once recorded in the ledger.
 */
public class Trade {

    private final long tradeId;
    private final long makerOrderId;
    private final long takerOrderId;
    private final int price;               // maker's price as submitted
    private final long quantity;
    private final Side side;               // taker's side as submitted
    private final long timestamp;          // epoch millis

    public Trade(long tradeId, long makerOrderId, long takerOrderId, int price,
                 long quantity, Side side, long timestamp) {
        this.tradeId = tradeId;
        this.makerOrderId = makerOrderId;
        this.takerOrderId = takerOrderId;
        this.price = price;
        this.quantity = quantity;
        this.side = side;
        this.timestamp = timestamp;
    }

    public long getTradeId() {
        return tradeId;
    }

    public long getMakerOrderId() {
        return makerOrderId;
    }

    public long getTakerOrderId() {
        return takerOrderId;
    }

    public int getPrice() {
        return price;
    }

    public long getQuantity() {
        return quantity;
    }

    public Side getSide() {
        return side;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
