package com.predictionmarket.matching;

import com.predictionmarket.domain.MatchResultSet;
import com.predictionmarket.domain.Order;
import com.predictionmarket.domain.OrderBook;
import com.predictionmarket.domain.OrderQueue;
import com.predictionmarket.domain.Trade;
import com.predictionmarket.ledger.TradeLedger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Price-time priority matching of canonical BUY orders.
 *
 * Both sides of a trade are stored as BUYs on complementary contracts, so an
 * incoming canonical YES order matches the resting YES queue and an incoming
 * NO order the resting NO queue. A taker crosses when its canonical price is
 * at least the maker's canonical price; market orders always cross.
 *
 * Self-trade prevention: resting orders of the taker's own account are held
 * aside while the scan continues, then restored with their original priority.
 *
 * Execution price is always the maker's price as submitted.
 */
public class PriceTimePriorityMatcher implements MatchingAlgorithm {

    private final TradeLedger ledger;
    private final LongSupplier clock;

    public PriceTimePriorityMatcher(TradeLedger ledger, LongSupplier clock) {
        this.ledger = ledger;
        this.clock = clock;
    }

    @Override
    public MatchResultSet match(OrderBook book, Order incoming) {
        List<Trade> trades = new ArrayList<>();
        List<Order> skipped = new ArrayList<>();
        long totalFilled = 0;

        OrderQueue queue = book.queueFor(incoming.getCanonicalSide());

        while (incoming.getRemainingQuantity() > 0 && !queue.isEmpty()) {
            Order maker = queue.peekBest();

            if (maker.getAccountId().equals(incoming.getAccountId())) {
                skipped.add(queue.popBest());
                continue;
            }

            // Nothing below the best non-self order can cross either
            if (!incoming.isMarket() && incoming.getCanonicalPrice() < maker.getCanonicalPrice()) {
                break;
            }

            queue.popBest();
            long fillQty = Math.min(incoming.getRemainingQuantity(), maker.getRemainingQuantity());

            incoming.fill(fillQty);
            maker.fill(fillQty);

            trades.add(ledger.record(
                    maker.getOrderId(),
                    incoming.getOrderId(),
                    maker.getOriginalPrice(),
                    fillQty,
                    incoming.getOriginalSide(),
                    clock.getAsLong()));
            totalFilled += fillQty;

            if (maker.isFilled()) {
                book.unindex(maker.getOrderId());
            } else {
                queue.push(maker);
            }
        }

        for (Order order : skipped) {
            queue.restore(order);
        }

        return new MatchResultSet(trades, totalFilled, incoming.isFilled());
    }
}
