package com.ordermanagement.logging;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters shared between request threads (writers) and the
 * periodic stats logger thread (reader).
 */
public class OrderFlowStats {

    public final AtomicLong ordersAdded = new AtomicLong();
    public final AtomicLong ordersRemoved = new AtomicLong();
    public final AtomicLong tradesExecuted = new AtomicLong();
    public final AtomicLong priceQueries = new AtomicLong();
    public final AtomicLong rejected = new AtomicLong();
}
