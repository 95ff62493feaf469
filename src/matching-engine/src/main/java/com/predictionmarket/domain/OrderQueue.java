package com.predictionmarket.domain;

import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

/**
 * Resting canonical BUY orders for one contract, ordered by {@link PriorityKey}.
 * Best order = highest price, then earliest timestamp, then lowest id.
 */
public class OrderQueue {

    private static final Comparator<Order> BY_PRIORITY = Comparator.comparing(Order::getPriorityKey);

    private final Side side;
    private final PriorityQueue<Order> orders;

    public OrderQueue(Side side) {
        this.side = side;
        this.orders = new PriorityQueue<>(BY_PRIORITY);
    }

    public void push(Order order) {
        orders.add(order);
    }

    public Order peekBest() {
        return orders.peek();
    }

    public Order popBest() {
        return orders.poll();
    }

    /**
     * Reinsert an order that was temporarily held aside. Its priority key was
     * fixed at creation, so it regains its exact queue position.
     */
    public void restore(Order order) {
        orders.add(order);
    }

    /**
     * Up to {@code n} best orders in priority order. Does not modify the queue.
     */
    public List<Order> best(int n) {
        return orders.stream()
                .sorted(BY_PRIORITY)
                .limit(Math.max(n, 0))
                .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    public int size() {
        return orders.size();
    }

    public long totalQuantity() {
        long total = 0;
        for (Order order : orders) {
            total += order.getRemainingQuantity();
        }
        return total;
    }

    public Side getSide() {
        return side;
    }
}
