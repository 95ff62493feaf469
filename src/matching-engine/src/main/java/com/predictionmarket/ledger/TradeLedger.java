package com.predictionmarket.ledger;

import com.predictionmarket.domain.Side;
import com.predictionmarket.domain.Trade;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only history of executed trades. Trade ids start at 1 and increase
 * by one per recorded trade.
 *
 * Not thread-safe. Owned by the engine and accessed under its lock.
 */
public class TradeLedger {

    private final List<Trade> trades = new ArrayList<>();
    private long nextTradeId = 1;

    public Trade record(long makerOrderId, long takerOrderId, int price, long quantity,
                        Side takerSide, long timestamp) {
        Trade trade = new Trade(nextTradeId++, makerOrderId, takerOrderId, price,
                quantity, takerSide, timestamp);
        trades.add(trade);
        return trade;
    }

    /**
     * The last {@code limit} trades, most recent first.
     */
    public List<Trade> recent(int limit) {
        int count = Math.min(Math.max(limit, 0), trades.size());
        List<Trade> result = new ArrayList<>(count);
        for (int i = trades.size() - 1; i >= trades.size() - count; i--) {
            result.add(trades.get(i));
        }
        return result;
    }

    public int size() {
        return trades.size();
    }
}
