package com.ordermanagement.domain;

/**
 * Resting order. Identity, symbol, side and price are fixed at creation;
 * only the remaining amount changes, and only downward through {@link OrderBook#fill}.
 */
public class Order {

    private final OrderId id;
    private final String symbol;
    private final Side side;
    private final Price price;
    private final long originalAmount;
    private long amount;
    private final long acceptedAt;     // epoch millis

    public Order(OrderId id, String symbol, Side side, long amount, Price price, long acceptedAt) {
        this.id = id;
        this.symbol = symbol;
        this.side = side;
        this.price = price;
        this.originalAmount = amount;
        this.amount = amount;
        this.acceptedAt = acceptedAt;
    }

    /**
     * Reduce the remaining amount. Package-private so that only the owning
     * book can shrink an order and keep its level totals in step.
     */
    void fill(long qty) {
        if (qty <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + qty);
        }
        if (qty > amount) {
            throw new IllegalArgumentException(
                "Fill quantity " + qty + " exceeds remaining " + amount);
        }
        amount -= qty;
    }

    public boolean isFilled() {
        return amount == 0;
    }

    public OrderId getId() {
        return id;
    }

    public String getSymbol() {
        return symbol;
    }

    public Side getSide() {
        return side;
    }

    public Price getPrice() {
        return price;
    }

    public long getOriginalAmount() {
        return originalAmount;
    }

    public long getAmount() {
        return amount;
    }

    public long getAcceptedAt() {
        return acceptedAt;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", symbol='" + symbol + '\'' +
                ", side=" + side +
                ", amount=" + amount +
                ", price=" + price.cents() +
                '}';
    }
}
