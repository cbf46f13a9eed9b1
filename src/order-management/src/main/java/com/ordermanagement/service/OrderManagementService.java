package com.ordermanagement.service;

import com.ordermanagement.domain.Order;
import com.ordermanagement.domain.OrderBook;
import com.ordermanagement.domain.OrderBookRegistry;
import com.ordermanagement.domain.OrderBookSnapshot;
import com.ordermanagement.domain.OrderFill;
import com.ordermanagement.domain.OrderId;
import com.ordermanagement.domain.Price;
import com.ordermanagement.domain.Side;
import com.ordermanagement.domain.Trade;
import com.ordermanagement.exception.DuplicateOrderException;
import com.ordermanagement.exception.InvalidOrderException;
import com.ordermanagement.exception.InvalidRequestException;
import com.ordermanagement.exception.OrderManagementException;
import com.ordermanagement.exception.OrderNotFoundException;
import com.ordermanagement.exception.UnknownSymbolException;
import com.ordermanagement.logging.OrderFlowStats;
import com.ordermanagement.matching.PriceCalculator;
import com.ordermanagement.matching.TradeExecutor;
import com.ordermanagement.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

import static com.ordermanagement.metrics.MetricsRegistry.nanosToSeconds;
import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Entry point for the four order operations: add, remove, price and trade.
 *
 * Concurrency: each book carries its own read/write lock. Add, remove and trade
 * take the write lock of the one book they touch; price and order book views take
 * the read lock. Operations on different symbols never contend.
 *
 * Order ids are unique across all books. A service-wide index maps each live
 * id to its symbol; it is updated while the owning book's write lock is held.
 */
public class OrderManagementService {

    private static final Logger logger = LoggerFactory.getLogger(OrderManagementService.class);

    private final OrderBookRegistry registry;
    private final PriceCalculator priceCalculator;
    private final TradeExecutor tradeExecutor;
    private final MetricsRegistry metrics;
    private final OrderFlowStats stats;
    private final Clock clock;
    private final ConcurrentHashMap<OrderId, String> orderSymbols;

    public OrderManagementService(OrderBookRegistry registry, MetricsRegistry metrics,
                                  OrderFlowStats stats) {
        this(registry, new PriceCalculator(), new TradeExecutor(), metrics, stats,
                Clock.systemUTC());
    }

    public OrderManagementService(OrderBookRegistry registry,
                                  PriceCalculator priceCalculator,
                                  TradeExecutor tradeExecutor,
                                  MetricsRegistry metrics,
                                  OrderFlowStats stats,
                                  Clock clock) {
        this.registry = registry;
        this.priceCalculator = priceCalculator;
        this.tradeExecutor = tradeExecutor;
        this.metrics = metrics;
        this.stats = stats;
        this.clock = clock;
        this.orderSymbols = new ConcurrentHashMap<>();
    }

    /**
     * Add a resting order, creating the symbol's book on first use.
     *
     * @throws InvalidOrderException if amount is not positive, price is negative,
     *                               or symbol/side is missing
     * @throws DuplicateOrderException if the id is already resting in any book
     */
    public Order addOrder(long orderId, String symbol, Side side, long amount, long price) {
        try {
            if (symbol == null || symbol.isBlank()) {
                throw new InvalidOrderException("Symbol is required");
            }
            if (side == null) {
                throw new InvalidOrderException("Side is required");
            }
            if (amount <= 0) {
                throw new InvalidOrderException("Amount must be positive: " + amount);
            }
            if (price < 0) {
                throw new InvalidOrderException("Price must be non-negative: " + price);
            }

            OrderId id = new OrderId(orderId);
            if (orderSymbols.putIfAbsent(id, symbol) != null) {
                throw new DuplicateOrderException("Order with ID " + orderId + " already exists");
            }

            OrderBook book = registry.getOrCreateBook(symbol);
            Order order = new Order(id, symbol, side, amount, new Price(price), clock.millis());

            book.writeLock().lock();
            try {
                book.insert(order);
            } catch (RuntimeException e) {
                orderSymbols.remove(id, symbol);
                throw e;
            } finally {
                book.writeLock().unlock();
            }

            String sideLabel = label(side);
            metrics.ordersAddedTotal.labelValues(sideLabel).inc();
            metrics.orderbookDepth.labelValues(sideLabel).inc();
            stats.ordersAdded.incrementAndGet();
            logger.debug("Added order {}", order);
            return order;
        } catch (OrderManagementException e) {
            recordRejection(e);
            throw e;
        }
    }

    /**
     * Remove a resting order from whichever book holds it.
     *
     * @throws OrderNotFoundException if no live order has this id
     */
    public void removeOrder(long orderId) {
        try {
            OrderId id = new OrderId(orderId);
            String symbol = orderSymbols.get(id);
            OrderBook book = symbol == null ? null : registry.getBook(symbol);
            if (book == null) {
                throw new OrderNotFoundException("Order " + orderId + " not found");
            }

            Order removed;
            book.writeLock().lock();
            try {
                removed = book.remove(id);
                orderSymbols.remove(id, symbol);
            } finally {
                book.writeLock().unlock();
            }

            metrics.ordersRemovedTotal.inc();
            metrics.orderbookDepth.labelValues(label(removed.getSide())).dec();
            stats.ordersRemoved.incrementAndGet();
            logger.debug("Removed order {}", removed);
        } catch (OrderManagementException e) {
            recordRejection(e);
            throw e;
        }
    }

    /**
     * Cost of filling {@code amount} on {@code side} against the current book,
     * without changing it.
     */
    public long calculatePrice(String symbol, Side side, long amount) {
        try {
            OrderBook book = requireBook(symbol, side, amount);

            long price;
            long start = System.nanoTime();
            book.readLock().lock();
            try {
                price = priceCalculator.calculate(book, side, amount);
            } finally {
                book.readLock().unlock();
            }
            metrics.priceCalculationDuration.observe(nanosToSeconds(System.nanoTime() - start));

            metrics.priceQueriesTotal.labelValues(label(side)).inc();
            stats.priceQueries.incrementAndGet();
            logger.debug("Priced {} {} {} at {}", side, amount, symbol, price);
            return price;
        } catch (OrderManagementException e) {
            recordRejection(e);
            throw e;
        }
    }

    /**
     * Execute {@code amount} on {@code side}, consuming counter-side orders.
     * Either the full amount is filled or the book is left as it was.
     */
    public Trade placeTrade(String symbol, Side side, long amount) {
        try {
            OrderBook book = requireBook(symbol, side, amount);

            Trade trade;
            int consumed = 0;
            long start = System.nanoTime();
            book.writeLock().lock();
            try {
                trade = tradeExecutor.execute(book, side, amount);
                for (OrderFill fill : trade.getOrderFills()) {
                    OrderId id = new OrderId(fill.orderId());
                    if (!book.contains(id)) {
                        orderSymbols.remove(id, symbol);
                        consumed++;
                    }
                }
            } finally {
                book.writeLock().unlock();
            }
            metrics.tradeDuration.observe(nanosToSeconds(System.nanoTime() - start));

            metrics.tradesTotal.labelValues(label(side)).inc();
            metrics.orderbookDepth.labelValues(label(side.opposite())).dec(consumed);
            stats.tradesExecuted.incrementAndGet();
            logger.info("Trade executed",
                    keyValue("tradeId", trade.getTradeId()),
                    keyValue("symbol", symbol),
                    keyValue("side", side),
                    keyValue("amount", amount),
                    keyValue("totalPrice", trade.getTotalPrice()),
                    keyValue("fills", trade.getFillCount()),
                    keyValue("ordersConsumed", consumed));
            return trade;
        } catch (OrderManagementException e) {
            recordRejection(e);
            throw e;
        }
    }

    /**
     * Both sides of a symbol's book in priority order. An unknown symbol
     * yields an empty view.
     */
    public OrderBookSnapshot getOrderBook(String symbol) {
        OrderBook book = symbol == null ? null : registry.getBook(symbol);
        if (book == null) {
            return OrderBookSnapshot.empty(symbol);
        }
        book.readLock().lock();
        try {
            return book.snapshot();
        } finally {
            book.readLock().unlock();
        }
    }

    public OrderBookRegistry getRegistry() {
        return registry;
    }

    private OrderBook requireBook(String symbol, Side side, long amount) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidRequestException("Symbol is required");
        }
        if (side == null) {
            throw new InvalidRequestException("Side is required");
        }
        OrderBook book = registry.getBook(symbol);
        if (book == null) {
            throw new UnknownSymbolException("No order book for symbol " + symbol);
        }
        if (amount <= 0) {
            throw new InvalidRequestException("Amount must be positive: " + amount);
        }
        return book;
    }

    private void recordRejection(OrderManagementException e) {
        metrics.rejectionsTotal.labelValues(e.getClass().getSimpleName()).inc();
        stats.rejected.incrementAndGet();
    }

    private static String label(Side side) {
        return side.name().toLowerCase();
    }
}
