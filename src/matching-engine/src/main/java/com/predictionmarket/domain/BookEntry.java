package com.predictionmarket.domain;

/**
 * Read-only projection of a resting order. Price is the price as submitted,
 * not the canonical one.
 */
public record BookEntry(long orderId, int price, long quantity, String accountId) {}
