package com.ordermanagement.domain;

import java.time.Instant;
import java.util.List;

/**
 * Result of executing one trade request against a book.
 * Immutable; holds no reference back to the book it was taken from.
 */
public class Trade {

    private final String tradeId;
    private final String symbol;
    private final Side side;
    private final long amount;
    private final long totalPrice;         // cents
    private final Instant executedAt;
    private final List<OrderFill> orderFills;

    public Trade(String tradeId, String symbol, Side side, long amount, long totalPrice,
                 Instant executedAt, List<OrderFill> orderFills) {
        this.tradeId = tradeId;
        this.symbol = symbol;
        this.side = side;
        this.amount = amount;
        this.totalPrice = totalPrice;
        this.executedAt = executedAt;
        this.orderFills = List.copyOf(orderFills);
    }

    public String getTradeId() {
        return tradeId;
    }

    public String getSymbol() {
        return symbol;
    }

    public Side getSide() {
        return side;
    }

    public long getAmount() {
        return amount;
    }

    public long getTotalPrice() {
        return totalPrice;
    }

    public Instant getExecutedAt() {
        return executedAt;
    }

    /**
     * One entry per resting order touched, in the order they were consumed.
     */
    public List<OrderFill> getOrderFills() {
        return orderFills;
    }

    public int getFillCount() {
        return orderFills.size();
    }
}
