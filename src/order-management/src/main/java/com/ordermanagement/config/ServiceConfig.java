package com.ordermanagement.config;

import java.util.Map;

/**
 * Configuration parsed from environment variables.
 * Missing, empty or unparsable values fall back to defaults.
 */
public class ServiceConfig {

    private final String serviceId;
    private final String httpHost;
    private final int httpPort;
    private final int metricsPort;
    private final int httpThreads;
    private final int statsIntervalSeconds;
    private final long maxOrderAmount;
    private final long maxOrderPrice;

    private ServiceConfig(String serviceId, String httpHost, int httpPort, int metricsPort,
                          int httpThreads, int statsIntervalSeconds,
                          long maxOrderAmount, long maxOrderPrice) {
        this.serviceId = serviceId;
        this.httpHost = httpHost;
        this.httpPort = httpPort;
        this.metricsPort = metricsPort;
        this.httpThreads = httpThreads;
        this.statsIntervalSeconds = statsIntervalSeconds;
        this.maxOrderAmount = maxOrderAmount;
        this.maxOrderPrice = maxOrderPrice;
    }

    /**
     * Parse configuration from environment variables with sensible defaults.
     */
    public static ServiceConfig fromEnv() {
        return fromMap(System.getenv());
    }

    public static ServiceConfig fromMap(Map<String, String> env) {
        String serviceId = get(env, "SERVICE_ID", "oms");
        String httpHost = get(env, "HTTP_HOST", "127.0.0.1");
        int httpPort = getInt(env, "HTTP_PORT", 8080);
        int metricsPort = getInt(env, "METRICS_PORT", 9091);
        int httpThreads = getInt(env, "HTTP_THREADS", Runtime.getRuntime().availableProcessors());
        int statsIntervalSeconds = getInt(env, "STATS_INTERVAL_SECONDS", 10);
        long maxOrderAmount = getLong(env, "MAX_ORDER_AMOUNT", 10_000_000L);
        long maxOrderPrice = getLong(env, "MAX_ORDER_PRICE", 10_000_000L);

        return new ServiceConfig(serviceId, httpHost, httpPort, metricsPort, httpThreads,
                statsIntervalSeconds, maxOrderAmount, maxOrderPrice);
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private static int getInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    private static long getLong(Map<String, String> env, String key, long defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getHttpHost() {
        return httpHost;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public int getHttpThreads() {
        return httpThreads;
    }

    public int getStatsIntervalSeconds() {
        return statsIntervalSeconds;
    }

    public long getMaxOrderAmount() {
        return maxOrderAmount;
    }

    public long getMaxOrderPrice() {
        return maxOrderPrice;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "serviceId='" + serviceId + '\'' +
                ", httpHost='" + httpHost + '\'' +
                ", httpPort=" + httpPort +
                ", metricsPort=" + metricsPort +
                ", httpThreads=" + httpThreads +
                ", statsIntervalSeconds=" + statsIntervalSeconds +
                ", maxOrderAmount=" + maxOrderAmount +
                ", maxOrderPrice=" + maxOrderPrice +
                '}';
    }
}
