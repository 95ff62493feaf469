package com.predictionmarket.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class OrderQueueTest {

    private OrderQueue queue;

    @BeforeEach
    void setUp() {
        queue = new OrderQueue(Side.YES);
    }

    private static Order buyYes(long id, int price, long qty, long timestamp) {
        return new Order(id, "acct-" + id, Side.YES, OrderType.BUY, price,
                Side.YES, price, false, qty, timestamp);
    }

    private static List<Long> ids(List<Order> orders) {
        return orders.stream().map(Order::getOrderId).collect(Collectors.toList());
    }

    @Test
    void higherPriceComesFirst() {
        queue.push(buyYes(1, 40, 5, 100));
        queue.push(buyYes(2, 60, 5, 200));
        queue.push(buyYes(3, 50, 5, 50));

        assertEquals(2, queue.peekBest().getOrderId());
        assertEquals(List.of(2L, 3L, 1L), ids(queue.best(10)));
    }

    @Test
    void earlierTimestampWinsAtEqualPrice() {
        queue.push(buyYes(1, 50, 5, 300));
        queue.push(buyYes(2, 50, 5, 100));

        assertEquals(2, queue.popBest().getOrderId());
        assertEquals(1, queue.popBest().getOrderId());
        assertNull(queue.popBest());
    }

    @Test
    void lowerIdWinsAtEqualPriceAndTimestamp() {
        queue.push(buyYes(7, 50, 5, 100));
        queue.push(buyYes(3, 50, 5, 100));

        assertEquals(3, queue.peekBest().getOrderId());
    }

    @Test
    void bestIsNonDestructiveAndBounded() {
        for (int i = 1; i <= 15; i++) {
            queue.push(buyYes(i, i, 1, 0));
        }

        List<Order> top = queue.best(10);
        assertEquals(10, top.size());
        assertEquals(15, top.get(0).getOrderId());
        assertEquals(6, top.get(9).getOrderId());
        assertEquals(15, queue.size());
        assertTrue(queue.best(0).isEmpty());
    }

    @Test
    void restoredOrderRegainsItsPosition() {
        Order first = buyYes(1, 50, 5, 100);
        queue.push(first);
        queue.push(buyYes(2, 50, 5, 200));

        Order held = queue.popBest();
        assertSame(first, held);
        queue.restore(held);

        assertEquals(1, queue.peekBest().getOrderId());
    }

    @Test
    void fillsDoNotChangePriority() {
        Order order = buyYes(1, 50, 10, 100);
        PriorityKey before = order.getPriorityKey();
        order.fill(4);

        assertEquals(before, order.getPriorityKey());
        assertEquals(6, order.getRemainingQuantity());
        assertEquals(4, order.getFilledQuantity());
    }

    @Test
    void overfillIsRejected() {
        Order order = buyYes(1, 50, 3, 100);
        assertThrows(IllegalArgumentException.class, () -> order.fill(4));
        assertThrows(IllegalArgumentException.class, () -> order.fill(0));
    }

    @Test
    void totalQuantitySumsRemaining() {
        queue.push(buyYes(1, 50, 3, 100));
        queue.push(buyYes(2, 55, 4, 100));
        assertEquals(7, queue.totalQuantity());
    }
}
