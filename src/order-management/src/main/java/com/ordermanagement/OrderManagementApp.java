package com.ordermanagement;

import com.ordermanagement.config.ServiceConfig;
import com.ordermanagement.domain.OrderBookRegistry;
import com.ordermanagement.http.HttpApiServer;
import com.ordermanagement.logging.OrderFlowStats;
import com.ordermanagement.logging.PeriodicStatsLogger;
import com.ordermanagement.metrics.MetricsRegistry;
import com.ordermanagement.service.OrderManagementService;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Main entry point for the Order Management service.
 *
 * Startup sequence:
 * 1. Parse ServiceConfig from environment variables
 * 2. Initialize MetricsRegistry + Prometheus HTTP server
 * 3. Initialize OrderBookRegistry and OrderManagementService
 * 4. Start the periodic stats logger
 * 5. Start HttpApiServer with /orders, /price, /trades, /orderbook, /health
 * 6. Register JVM shutdown hook
 */
public class OrderManagementApp {

    private static final Logger logger = LoggerFactory.getLogger(OrderManagementApp.class);

    public static void main(String[] args) {
        logger.info("Starting Order Management service...");

        // 1. Parse configuration from environment variables
        ServiceConfig config = ServiceConfig.fromEnv();
        logger.info("Configuration: {}", config);

        // 2. Initialize MetricsRegistry and start Prometheus HTTP server
        MetricsRegistry metrics = new MetricsRegistry(PrometheusRegistry.defaultRegistry);
        metrics.registerJvmMetrics();
        try {
            metrics.startHttpServer(config.getMetricsPort());
            logger.info("Prometheus metrics HTTP server started on port {}",
                    config.getMetricsPort());
        } catch (IOException e) {
            logger.error("Failed to start Prometheus HTTP server on port {}: {}",
                    config.getMetricsPort(), e.getMessage());
            System.exit(1);
        }

        // 3. Initialize the books and the service facade
        OrderBookRegistry registry = new OrderBookRegistry();
        OrderFlowStats stats = new OrderFlowStats();
        OrderManagementService service = new OrderManagementService(registry, metrics, stats);

        // 4. Start periodic stats logger (separate daemon thread)
        PeriodicStatsLogger statsLogger = new PeriodicStatsLogger(
                stats, registry, config.getServiceId(), config.getStatsIntervalSeconds());
        statsLogger.start();

        // 5. Start HTTP server
        HttpApiServer httpServer = new HttpApiServer(config, service);
        try {
            httpServer.start();
        } catch (IOException e) {
            logger.error("Failed to start HTTP server on port {}: {}",
                    config.getHttpPort(), e.getMessage());
            System.exit(1);
        }

        // 6. Register shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down Order Management service...");
            httpServer.stop();
            logger.info("HTTP server stopped.");

            statsLogger.logShutdownSummary();
            statsLogger.stop();

            metrics.close();
            logger.info("Order Management service shut down complete.");
        }));

        logger.info("Order Management service is ready. Service: {}, HTTP: {}, Metrics: {}",
                config.getServiceId(), httpServer.getPort(), config.getMetricsPort());
    }
}
