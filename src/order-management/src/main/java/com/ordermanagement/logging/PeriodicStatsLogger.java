package com.ordermanagement.logging;

import com.ordermanagement.domain.OrderBook;
import com.ordermanagement.domain.OrderBookRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Logs aggregate order flow statistics every N seconds on a separate daemon thread.
 * Book depth is read under each book's read lock, one book at a time.
 */
public class PeriodicStatsLogger {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicStatsLogger.class);

    private final OrderFlowStats stats;
    private final OrderBookRegistry registry;
    private final String serviceId;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private long lastAdded;
    private long lastRemoved;
    private long lastTrades;
    private long lastRejected;

    public PeriodicStatsLogger(OrderFlowStats stats, OrderBookRegistry registry,
                               String serviceId, int intervalSeconds) {
        this.stats = stats;
        this.registry = registry;
        this.serviceId = serviceId;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "periodic-stats-logger");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::logSummary, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        logger.info("Periodic stats logger started",
                keyValue("event", "STATS_LOGGER_STARTED"),
                keyValue("service", serviceId),
                keyValue("intervalSeconds", intervalSeconds));
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Log a final lifetime summary on shutdown.
     */
    public void logShutdownSummary() {
        logger.info("Shutdown summary",
                keyValue("event", "SHUTDOWN_SUMMARY"),
                keyValue("service", serviceId),
                keyValue("totalOrdersAdded", stats.ordersAdded.get()),
                keyValue("totalOrdersRemoved", stats.ordersRemoved.get()),
                keyValue("totalTrades", stats.tradesExecuted.get()),
                keyValue("totalPriceQueries", stats.priceQueries.get()),
                keyValue("totalRejected", stats.rejected.get()));
    }

    void logSummary() {
        try {
            long currentAdded = stats.ordersAdded.get();
            long currentRemoved = stats.ordersRemoved.get();
            long currentTrades = stats.tradesExecuted.get();
            long currentRejected = stats.rejected.get();

            long deltaAdded = currentAdded - lastAdded;
            long deltaRemoved = currentRemoved - lastRemoved;
            long deltaTrades = currentTrades - lastTrades;
            long deltaRejected = currentRejected - lastRejected;

            lastAdded = currentAdded;
            lastRemoved = currentRemoved;
            lastTrades = currentTrades;
            lastRejected = currentRejected;

            int books = 0, bidDepth = 0, askDepth = 0, bidLevels = 0, askLevels = 0;
            for (OrderBook book : registry.getAllBooks()) {
                book.readLock().lock();
                try {
                    books++;
                    bidDepth += book.getBidDepth();
                    askDepth += book.getAskDepth();
                    bidLevels += book.getBidLevelCount();
                    askLevels += book.getAskLevelCount();
                } finally {
                    book.readLock().unlock();
                }
            }

            logger.info("Periodic summary",
                    keyValue("event", "PERIODIC_SUMMARY"),
                    keyValue("service", serviceId),
                    keyValue("intervalSeconds", intervalSeconds),
                    keyValue("ordersAdded", deltaAdded),
                    keyValue("ordersRemoved", deltaRemoved),
                    keyValue("trades", deltaTrades),
                    keyValue("rejected", deltaRejected),
                    keyValue("books", books),
                    keyValue("bidDepth", bidDepth),
                    keyValue("askDepth", askDepth),
                    keyValue("bidLevels", bidLevels),
                    keyValue("askLevels", askLevels));
        } catch (Exception e) {
            logger.error("Error in periodic stats logging", e);
        }
    }
}
