package com.ordermanagement.domain;

import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages order books for multiple symbols.
 * Maps symbol name to OrderBook instance. Books are created lazily on first
 * add and never dropped, so a book that has been emptied still exists.
 */
public class OrderBookRegistry {

    private final ConcurrentHashMap<String, OrderBook> books;

    public OrderBookRegistry() {
        this.books = new ConcurrentHashMap<>();
    }

    /**
     * Get or create an OrderBook for the given symbol.
     */
    public OrderBook getOrCreateBook(String symbol) {
        return books.computeIfAbsent(symbol, OrderBook::new);
    }

    /**
     * Get an existing OrderBook. Returns null if not found.
     */
    public OrderBook getBook(String symbol) {
        return books.get(symbol);
    }

    public Collection<OrderBook> getAllBooks() {
        return books.values();
    }
}
