package com.predictionmarket.metrics;

import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import io.prometheus.metrics.instrumentation.jvm.JvmMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;

import java.io.IOException;

/**
 * All Prometheus metrics for the prediction market engine, defined in one place.
 */
public class MetricsRegistry {

    public final Histogram placeDuration;
    // name: pm_place_duration_seconds

    public final Counter ordersReceivedTotal;
    // name: pm_orders_received_total

    public final Counter ordersRejectedTotal;
    // name: pm_orders_rejected_total

    public final Counter tradesTotal;
    // name: pm_trades_total

    public final Counter tradedQuantityTotal;
    // name: pm_traded_quantity_total

    public final Gauge restingOrders;
    // name: pm_resting_orders

    private final PrometheusRegistry registry;
    private HTTPServer httpServer;

    public MetricsRegistry() {
        this(PrometheusRegistry.defaultRegistry);
    }

    public MetricsRegistry(PrometheusRegistry registry) {
        this.registry = registry;

        // Time spent holding the engine lock for one order
        placeDuration = Histogram.builder()
                .name("pm_place_duration_seconds")
                .help("Time to normalize, match and rest one order")
                .classicOnly()
                .classicUpperBounds(0.00001, 0.00005, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05)
                .register(registry);

        ordersReceivedTotal = Counter.builder()
                .name("pm_orders_received_total")
                .help("Total orders accepted by the engine")
                .labelNames("side", "type")
                .register(registry);

        ordersRejectedTotal = Counter.builder()
                .name("pm_orders_rejected_total")
                .help("Total order requests rejected by validation")
                .register(registry);

        tradesTotal = Counter.builder()
                .name("pm_trades_total")
                .help("Total trades executed")
                .register(registry);

        tradedQuantityTotal = Counter.builder()
                .name("pm_traded_quantity_total")
                .help("Total shares traded")
                .register(registry);

        restingOrders = Gauge.builder()
                .name("pm_resting_orders")
                .help("Current resting orders per canonical book")
                .labelNames("book")
                .register(registry);
    }

    /**
     * Register JVM metrics (GC, memory, threads).
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

    public void close() {
        if (httpServer != null) {
            httpServer.close();
        }
    }
}
