package com.ordermanagement.domain;

import java.util.List;

/**
 * Point-in-time copy of one book, both sides in priority order.
 */
public record OrderBookSnapshot(String symbol, List<Entry> buyOrders, List<Entry> sellOrders) {

    public OrderBookSnapshot {
        buyOrders = List.copyOf(buyOrders);
        sellOrders = List.copyOf(sellOrders);
    }

    public static OrderBookSnapshot empty(String symbol) {
        return new OrderBookSnapshot(symbol, List.of(), List.of());
    }

    public record Entry(long orderId, long price, long amount) {}
}
