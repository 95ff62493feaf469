package com.predictionmarket.view;

import com.predictionmarket.domain.BookEntry;
import com.predictionmarket.domain.MarketSnapshot;
import com.predictionmarket.domain.Order;
import com.predictionmarket.domain.OrderBook;
import com.predictionmarket.domain.OrderType;
import com.predictionmarket.domain.Side;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds the conventional four-sided view from the two canonical queues.
 *
 * YES queue holds BUY YES and converted SELL NO orders. Both are shown as YES
 * bids; the SELL NO orders are also shown as NO asks.
 * NO queue holds BUY NO and converted SELL YES orders. Both are shown as NO
 * bids; the SELL YES orders are also shown as YES asks.
 *
 * Each side is taken from the {@code depth} best entries of its queue and
 * reports the price as submitted. Read-only.
 */
public class MarketViewReconstructor {

    public static final int DEFAULT_DEPTH = 10;

    public MarketSnapshot snapshot(OrderBook book) {
        return snapshot(book, DEFAULT_DEPTH);
    }

    public MarketSnapshot snapshot(OrderBook book, int depth) {
        List<Order> yesTop = book.getYesQueue().best(depth);
        List<Order> noTop = book.getNoQueue().best(depth);

        List<BookEntry> yesBids = new ArrayList<>();
        List<BookEntry> noAsks = new ArrayList<>();
        for (Order order : yesTop) {
            if (isOriginally(order, OrderType.BUY, Side.YES)) {
                yesBids.add(order.toBookEntry());
            } else if (isOriginally(order, OrderType.SELL, Side.NO)) {
                yesBids.add(order.toBookEntry());
                noAsks.add(order.toBookEntry());
            }
        }

        List<BookEntry> noBids = new ArrayList<>();
        List<BookEntry> yesAsks = new ArrayList<>();
        for (Order order : noTop) {
            if (isOriginally(order, OrderType.BUY, Side.NO)) {
                noBids.add(order.toBookEntry());
            } else if (isOriginally(order, OrderType.SELL, Side.YES)) {
                noBids.add(order.toBookEntry());
                yesAsks.add(order.toBookEntry());
            }
        }

        return new MarketSnapshot(yesBids, yesAsks, noBids, noAsks);
    }

    private static boolean isOriginally(Order order, OrderType type, Side side) {
        return order.getOriginalType() == type && order.getOriginalSide() == side;
    }
}
