package com.predictionmarket.domain;

/**
 * Outcome of placing an order. OPEN and PARTIALLY_FILLED orders rest in the book.
 */
public enum OrderStatus {
    OPEN,
    PARTIALLY_FILLED,
    FILLED
}
