package com.ordermanagement.metrics;

import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import io.prometheus.metrics.instrumentation.jvm.JvmMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;

import java.io.IOException;

/**
 * All Prometheus metrics for the order management service, defined in one place.
 * Registered against an explicit registry so that independent instances do not collide.
 */
public class MetricsRegistry {

    // ---- Order flow ----
    public final Counter ordersAddedTotal;
    // name: oms_orders_added_total

    public final Counter ordersRemovedTotal;
    // name: oms_orders_removed_total

    public final Counter tradesTotal;
    // name: oms_trades_total

    public final Counter priceQueriesTotal;
    // name: oms_price_queries_total

    public final Counter rejectionsTotal;
    // name: oms_rejections_total

    // ---- Latency ----
    public final Histogram tradeDuration;
    // name: oms_trade_duration_seconds

    public final Histogram priceCalculationDuration;
    // name: oms_price_calculation_duration_seconds

    // ---- Order Book health ----
    public final Gauge orderbookDepth;
    // name: oms_orderbook_depth

    private final PrometheusRegistry registry;
    private HTTPServer httpServer;

    public MetricsRegistry(PrometheusRegistry registry) {
        this.registry = registry;

        ordersAddedTotal = Counter.builder()
                .name("oms_orders_added_total")
                .help("Orders accepted into a book")
                .labelNames("side")
                .register(registry);

        ordersRemovedTotal = Counter.builder()
                .name("oms_orders_removed_total")
                .help("Orders removed on request")
                .register(registry);

        tradesTotal = Counter.builder()
                .name("oms_trades_total")
                .help("Trades executed")
                .labelNames("side")
                .register(registry);

        priceQueriesTotal = Counter.builder()
                .name("oms_price_queries_total")
                .help("Price calculations answered")
                .labelNames("side")
                .register(registry);

        rejectionsTotal = Counter.builder()
                .name("oms_rejections_total")
                .help("Operations rejected, by failure kind")
                .labelNames("reason")
                .register(registry);

        tradeDuration = Histogram.builder()
                .name("oms_trade_duration_seconds")
                .help("Time spent executing a trade against a book")
                .classicOnly()
                .classicUpperBounds(0.00001, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05)
                .register(registry);

        priceCalculationDuration = Histogram.builder()
                .name("oms_price_calculation_duration_seconds")
                .help("Time spent pricing a request against a book")
                .classicOnly()
                .classicUpperBounds(0.00001, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05)
                .register(registry);

        orderbookDepth = Gauge.builder()
                .name("oms_orderbook_depth")
                .help("Current resting orders across all books")
                .labelNames("side")
                .register(registry);
    }

    /**
     * Add JVM metrics (GC, memory, threads). Only the running service does this;
     * tests build registries without them.
     */
    public void registerJvmMetrics() {
        JvmMetrics.builder().register(registry);
    }

    /**
     * Start the Prometheus HTTP server on the given port.
     * Exposes /metrics endpoint for Prometheus scraping.
     */
    public void startHttpServer(int port) throws IOException {
        httpServer = HTTPServer.builder()
                .port(port)
                .registry(registry)
                .buildAndStart();
    }

    /**
     * Stop the Prometheus HTTP server.
     */
    public void close() {
        if (httpServer != null) {
            httpServer.close();
        }
    }

    public static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }
}
