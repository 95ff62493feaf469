package com.predictionmarket.domain;

/**
 * An order as submitted by a participant, already validated by the HTTP layer:
 * price is in [0, 100] and quantity is at least 1.
 */
public record OrderRequest(Side side, OrderType type, int price, long quantity, String accountId) {}
