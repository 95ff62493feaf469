package com.predictionmarket.domain;

/**
 * Order entity stored in canonical BUY form. The original side, type and price
 * are retained for execution pricing and for rebuilding the four-sided view.
 * Mutable: only remainingQuantity changes, as the order is matched.
 */
public class Order {

    private final long orderId;
    private final String accountId;
    private final Side originalSide;
    private final OrderType originalType;
    private final int originalPrice;
    private final Side canonicalSide;
    private final int canonicalPrice;
    private final boolean market;
    private final long originalQuantity;
    private long remainingQuantity;
    private final long timestamp;
    private final PriorityKey priorityKey;

    public Order(long orderId, String accountId, Side originalSide, OrderType originalType,
                 int originalPrice, Side canonicalSide, int canonicalPrice, boolean market,
                 long quantity, long timestamp) {
        this.orderId = orderId;
        this.accountId = accountId;
        this.originalSide = originalSide;
        this.originalType = originalType;
        this.originalPrice = originalPrice;
        this.canonicalSide = canonicalSide;
        this.canonicalPrice = canonicalPrice;
        this.market = market;
        this.originalQuantity = quantity;
        this.remainingQuantity = quantity;
        this.timestamp = timestamp;
        this.priorityKey = new PriorityKey(canonicalPrice, timestamp, orderId);
    }

    /**
     * Reduce the remaining quantity by a fill. The priority key is untouched.
     */
    public void fill(long qty) {
        if (qty <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + qty);
        }
        if (qty > remainingQuantity) {
            throw new IllegalArgumentException(
                "Fill quantity " + qty + " exceeds remaining " + remainingQuantity);
        }
        remainingQuantity -= qty;
    }

    public boolean isFilled() {
        return remainingQuantity == 0;
    }

    public long getFilledQuantity() {
        return originalQuantity - remainingQuantity;
    }

    public BookEntry toBookEntry() {
        return new BookEntry(orderId, originalPrice, remainingQuantity, accountId);
    }

    public long getOrderId() {
        return orderId;
    }

    public String getAccountId() {
        return accountId;
    }

    public Side getOriginalSide() {
        return originalSide;
    }

    public OrderType getOriginalType() {
        return originalType;
    }

    public int getOriginalPrice() {
        return originalPrice;
    }

    public Side getCanonicalSide() {
        return canonicalSide;
    }

    public int getCanonicalPrice() {
        return canonicalPrice;
    }

    public boolean isMarket() {
        return market;
    }

    public long getOriginalQuantity() {
        return originalQuantity;
    }

    public long getRemainingQuantity() {
        return remainingQuantity;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public PriorityKey getPriorityKey() {
        return priorityKey;
    }
}
