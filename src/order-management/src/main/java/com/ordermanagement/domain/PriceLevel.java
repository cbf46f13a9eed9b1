package com.ordermanagement.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;

/**
 * FIFO queue of orders at a single price point.
 * Backed by an insertion-ordered map so that iteration follows arrival order
 * while removal by id stays O(1).
 */
public class PriceLevel {

    private final LinkedHashMap<OrderId, Order> orders;
    private long totalAmount;

    public PriceLevel() {
        this.orders = new LinkedHashMap<>();
        this.totalAmount = 0;
    }

    public void addOrder(Order order) {
        totalAmount = Math.addExact(totalAmount, order.getAmount());
        orders.put(order.getId(), order);
    }

    public void removeOrder(Order order) {
        if (orders.remove(order.getId()) != null) {
            totalAmount -= order.getAmount();
        }
    }

    /**
     * Account for a partial or full fill of an order resting at this level.
     * The order keeps its position in the queue.
     */
    void reduce(long qty) {
        totalAmount -= qty;
    }

    /**
     * Read-only view of the resting orders in arrival order.
     */
    public Collection<Order> orders() {
        return Collections.unmodifiableCollection(orders.values());
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    public long getTotalAmount() {
        return totalAmount;
    }

    public int getOrderCount() {
        return orders.size();
    }
}
