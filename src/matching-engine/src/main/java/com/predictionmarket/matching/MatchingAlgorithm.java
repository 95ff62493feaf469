package com.predictionmarket.matching;

import com.predictionmarket.domain.MatchResultSet;
import com.predictionmarket.domain.Order;
import com.predictionmarket.domain.OrderBook;

/**
 * Interface for order matching algorithms.
 * The matching algorithm takes an order book and an incoming canonical order,
 * and returns the set of trades produced. Resting any remainder is left to the caller.
 */
public interface MatchingAlgorithm {
    MatchResultSet match(OrderBook book, Order incomingOrder);
}
