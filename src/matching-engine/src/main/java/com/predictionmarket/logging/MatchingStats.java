package com.predictionmarket.logging;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters shared between the engine (writer) and the periodic
 * stats logger thread (reader).
 */
public class MatchingStats {

    public final AtomicLong yesOrdersReceived = new AtomicLong();
    public final AtomicLong noOrdersReceived = new AtomicLong();
    public final AtomicLong tradesExecuted = new AtomicLong();
    public final AtomicLong sharesTraded = new AtomicLong();
    public final AtomicLong ordersRejected = new AtomicLong();
}
