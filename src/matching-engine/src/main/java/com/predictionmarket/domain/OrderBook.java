package com.predictionmarket.domain;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory order book for the single YES/NO market.
 *
 * Holds exactly two queues, one per canonical side. Every resting order is a
 * canonical BUY; asks are never stored, they are derived from the original
 * side and type of the resting orders.
 * Order index: HashMap for O(1) lookup of resting orders by id.
 *
 * Not thread-safe. Callers serialize access.
 */
public class OrderBook {

    private final OrderQueue yesQueue;
    private final OrderQueue noQueue;
    private final Map<Long, Order> orderIndex;

    public OrderBook() {
        this.yesQueue = new OrderQueue(Side.YES);
        this.noQueue = new OrderQueue(Side.NO);
        this.orderIndex = new HashMap<>();
    }

    public OrderQueue queueFor(Side canonicalSide) {
        return canonicalSide == Side.YES ? yesQueue : noQueue;
    }

    /**
     * Rest an order in the queue of its own canonical side and index it.
     */
    public void rest(Order order) {
        if (order.getRemainingQuantity() <= 0) {
            throw new IllegalStateException("Cannot rest order " + order.getOrderId()
                    + " with quantity " + order.getRemainingQuantity());
        }
        queueFor(order.getCanonicalSide()).push(order);
        orderIndex.put(order.getOrderId(), order);
    }

    /**
     * Forget a resting order that has been fully consumed.
     */
    public void unindex(long orderId) {
        orderIndex.remove(orderId);
    }

    public Optional<Order> lookup(long orderId) {
        return Optional.ofNullable(orderIndex.get(orderId));
    }


    public OrderQueue getYesQueue() {
        return yesQueue;
    }

    public OrderQueue getNoQueue() {
        return noQueue;
    }
}
