package com.ordermanagement.http;

import com.ordermanagement.config.ServiceConfig;
import com.ordermanagement.service.OrderManagementService;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Binds the JSON handlers to a JDK HttpServer.
 * Requests run on a fixed pool; per-symbol serialization happens inside the service.
 */
public class HttpApiServer {

    private static final Logger logger = LoggerFactory.getLogger(HttpApiServer.class);

    private final ServiceConfig config;
    private final OrderManagementService service;
    private HttpServer httpServer;
    private ExecutorService executor;

    public HttpApiServer(ServiceConfig config, OrderManagementService service) {
        this.config = config;
        this.service = service;
    }

    public void start() throws IOException {
        httpServer = HttpServer.create(
                new InetSocketAddress(config.getHttpHost(), config.getHttpPort()), 0);
        httpServer.createContext("/orders", new OrderHttpHandler(service, config));
        httpServer.createContext("/price", new PriceHttpHandler(service, config));
        httpServer.createContext("/trades", new TradeHttpHandler(service, config));
        httpServer.createContext("/orderbook", new OrderBookHttpHandler(service, config));
        httpServer.createContext("/health", new HealthHttpHandler(config));
        executor = Executors.newFixedThreadPool(Math.max(1, config.getHttpThreads()));
        httpServer.setExecutor(executor);
        httpServer.start();
        logger.info("HTTP server started on {}:{}", config.getHttpHost(), getPort());
    }

    /**
     * Actual bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return httpServer.getAddress().getPort();
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
