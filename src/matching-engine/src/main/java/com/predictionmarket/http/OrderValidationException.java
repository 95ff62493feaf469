package com.predictionmarket.http;

/**
 * An order request that must be rejected before it reaches the engine.
 */
public class OrderValidationException extends Exception {

    public OrderValidationException(String message) {
        super(message);
    }
}
