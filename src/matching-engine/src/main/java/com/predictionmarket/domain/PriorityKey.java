package com.predictionmarket.domain;

/**
 * Heap ordering of a resting canonical BUY order: higher price first, then
 * earlier timestamp, then lower order id. Fixed at order creation.
 */
public record PriorityKey(int price, long timestamp, long orderId) implements Comparable<PriorityKey> {

    @Override
    public int compareTo(PriorityKey other) {
        int byPrice = Integer.compare(other.price, this.price);
        if (byPrice != 0) {
            return byPrice;
        }
        int byTime = Long.compare(this.timestamp, other.timestamp);
        if (byTime != 0) {
            return byTime;
        }
        return Long.compare(this.orderId, other.orderId);
    }
}
