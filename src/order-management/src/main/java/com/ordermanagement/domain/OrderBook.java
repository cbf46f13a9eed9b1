package com.ordermanagement.domain;

import com.ordermanagement.exception.DuplicateOrderException;
import com.ordermanagement.exception.InvalidOrderException;
import com.ordermanagement.exception.OrderNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory order book for a single symbol.
 *
 * Bids: TreeMap with Comparator.reverseOrder() so firstKey() = highest bid.
 * Asks: TreeMap with natural ordering so firstKey() = lowest ask.
 * Each price level keeps its orders in arrival order, which gives price-time priority.
 * Order index: HashMap for O(1) lookup by orderId.
 *
 * The book itself is not thread-safe. Callers hold {@link #writeLock()} for
 * insert, remove and fill, and at least {@link #readLock()} for anything that
 * walks the book.
 */
public class OrderBook {

    private final String symbol;
    private final TreeMap<Price, PriceLevel> bids;
    private final TreeMap<Price, PriceLevel> asks;
    private final HashMap<OrderId, Order> orderIndex;
    private long bidTotal;
    private long askTotal;
    private final ReentrantReadWriteLock lock;

    public OrderBook(String symbol) {
        this.symbol = symbol;
        this.bids = new TreeMap<>(Comparator.reverseOrder());
        this.asks = new TreeMap<>();
        this.orderIndex = new HashMap<>();
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * Add an order to the appropriate side of the book.
     * BUY orders go to bids, SELL orders go to asks. O(log P) in the number of price levels.
     */
    public void insert(Order order) {
        if (order.getAmount() <= 0) {
            throw new InvalidOrderException("Amount must be positive: " + order.getAmount());
        }
        if (order.getPrice() == null || order.getPrice().cents() < 0) {
            throw new InvalidOrderException("Price must be non-negative: " + order.getPrice());
        }
        if (order.getSide() == null) {
            throw new InvalidOrderException("Side is required for order " + order.getId());
        }
        if (orderIndex.containsKey(order.getId())) {
            throw new DuplicateOrderException("Order with ID " + order.getId() + " already exists");
        }
        long sideTotal;
        try {
            sideTotal = Math.addExact(getTotalAmount(order.getSide()), order.getAmount());
        } catch (ArithmeticException e) {
            throw new InvalidOrderException("Amount " + order.getAmount()
                    + " would overflow the resting " + order.getSide() + " total of " + symbol);
        }
        PriceLevel level = levelsFor(order.getSide())
                .computeIfAbsent(order.getPrice(), p -> new PriceLevel());
        level.addOrder(order);
        orderIndex.put(order.getId(), order);
        setTotalAmount(order.getSide(), sideTotal);
    }

    /**
     * Remove an order by id. Looks up in the index, removes from the
     * appropriate price level, and cleans up empty levels.
     */
    public Order remove(OrderId orderId) {
        Order order = orderIndex.remove(orderId);
        if (order == null) {
            throw new OrderNotFoundException("Order " + orderId + " not found in " + symbol);
        }
        TreeMap<Price, PriceLevel> side = levelsFor(order.getSide());
        PriceLevel level = side.get(order.getPrice());
        if (level != null) {
            level.removeOrder(order);
            setTotalAmount(order.getSide(), getTotalAmount(order.getSide()) - order.getAmount());
            if (level.isEmpty()) {
                side.remove(order.getPrice());
            }
        }
        return order;
    }

    public Order get(OrderId orderId) {
        Order order = orderIndex.get(orderId);
        if (order == null) {
            throw new OrderNotFoundException("Order " + orderId + " not found in " + symbol);
        }
        return order;
    }

    public boolean contains(OrderId orderId) {
        return orderIndex.containsKey(orderId);
    }

    /**
     * Consume {@code qty} units of a resting order. The order keeps its place
     * in the queue while it has amount left and is removed once it reaches zero.
     *
     * @return the amount still resting after the fill
     */
    public long fill(OrderId orderId, long qty) {
        Order order = get(orderId);
        PriceLevel level = levelsFor(order.getSide()).get(order.getPrice());
        order.fill(qty);
        level.reduce(qty);
        setTotalAmount(order.getSide(), getTotalAmount(order.getSide()) - qty);
        if (order.isFilled()) {
            remove(orderId);
        }
        return order.getAmount();
    }

    /**
     * Lazy front-to-back view over one side in priority order: best price first,
     * then arrival order. Every call to {@code iterator()} walks the current state
     * of the book; nothing is copied. The iterators do not support removal.
     */
    public Iterable<Order> peekSide(Side side) {
        TreeMap<Price, PriceLevel> levels = levelsFor(side);
        return () -> new SideIterator(levels.values().iterator());
    }

    /**
     * Sum of resting amount on one side. Never exceeds Long.MAX_VALUE:
     * inserts that would push it past are rejected.
     */
    public long getTotalAmount(Side side) {
        return side == Side.BUY ? bidTotal : askTotal;
    }

    /**
     * Total number of resting orders on the bid side across all price levels.
     */
    public int getBidDepth() {
        int depth = 0;
        for (PriceLevel level : bids.values()) {
            depth += level.getOrderCount();
        }
        return depth;
    }

    /**
     * Total number of resting orders on the ask side across all price levels.
     */
    public int getAskDepth() {
        int depth = 0;
        for (PriceLevel level : asks.values()) {
            depth += level.getOrderCount();
        }
        return depth;
    }

    public int getBidLevelCount() {
        return bids.size();
    }

    public int getAskLevelCount() {
        return asks.size();
    }

    public int size() {
        return orderIndex.size();
    }

    public OrderBookSnapshot snapshot() {
        return new OrderBookSnapshot(symbol, entries(Side.BUY), entries(Side.SELL));
    }

    public String getSymbol() {
        return symbol;
    }

    public Lock readLock() {
        return lock.readLock();
    }

    public Lock writeLock() {
        return lock.writeLock();
    }

    private List<OrderBookSnapshot.Entry> entries(Side side) {
        List<OrderBookSnapshot.Entry> entries = new ArrayList<>();
        for (Order order : peekSide(side)) {
            entries.add(new OrderBookSnapshot.Entry(
                    order.getId().value(), order.getPrice().cents(), order.getAmount()));
        }
        return entries;
    }

    private void setTotalAmount(Side side, long total) {
        if (side == Side.BUY) {
            bidTotal = total;
        } else {
            askTotal = total;
        }
    }

    private TreeMap<Price, PriceLevel> levelsFor(Side side) {
        return side == Side.BUY ? bids : asks;
    }

    private static final class SideIterator implements Iterator<Order> {

        private final Iterator<PriceLevel> levels;
        private Iterator<Order> current = Collections.emptyIterator();

        SideIterator(Iterator<PriceLevel> levels) {
            this.levels = levels;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && levels.hasNext()) {
                current = levels.next().orders().iterator();
            }
            return current.hasNext();
        }

        @Override
        public Order next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
