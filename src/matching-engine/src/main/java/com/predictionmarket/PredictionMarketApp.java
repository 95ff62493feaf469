package com.predictionmarket;

import com.predictionmarket.config.EngineConfig;
import com.predictionmarket.engine.MatchingEngine;
import com.predictionmarket.http.ExchangeHttpServer;
import com.predictionmarket.logging.MatchingStats;
import com.predictionmarket.logging.PeriodicStatsLogger;
import com.predictionmarket.metrics.MetricsRegistry;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main entry point for the prediction market exchange.
 *
 * Startup sequence:
 * 1. Parse EngineConfig from environment variables
 * 2. Initialize MetricsRegistry + Prometheus HTTP server
 * 3. Initialize MatchingEngine
 * 4. Start the periodic stats logger
 * 5. Start HttpServer with /orders, /orderbook, /trades, /reset, / handlers
 * 6. Register JVM shutdown hook
 */
public class PredictionMarketApp {

    private static final Logger logger = LoggerFactory.getLogger(PredictionMarketApp.class);

    public static void main(String[] args) {
        logger.info("Starting Prediction Market Exchange...");

        // 1. Parse configuration from environment variables
        EngineConfig config = EngineConfig.fromEnv();
        logger.info("Configuration: {}", config);

        // 2. Initialize MetricsRegistry and start Prometheus HTTP server
        MetricsRegistry metrics = new MetricsRegistry();
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

        // 3. Initialize the engine
        MatchingStats matchingStats = new MatchingStats();
        MatchingEngine engine = new MatchingEngine(metrics, matchingStats, config.isDetailedLogging());

        // 4. Periodic stats logger (separate daemon thread)
        PeriodicStatsLogger statsLogger = new PeriodicStatsLogger(
                matchingStats, engine, config.getStatsIntervalSeconds());
        statsLogger.start();

        // 5. Start HTTP server
        ExecutorService httpExecutor = Executors.newFixedThreadPool(
                Runtime.getRuntime().availableProcessors());
        HttpServer httpServer = null;
        try {
            httpServer = ExchangeHttpServer.create(
                    new InetSocketAddress(config.getHttpPort()), httpExecutor,
                    engine, metrics, matchingStats, config);
            httpServer.start();
            logger.info("HTTP server started on port {}", config.getHttpPort());
        } catch (IOException e) {
            logger.error("Failed to start HTTP server on port {}: {}",
                    config.getHttpPort(), e.getMessage());
            System.exit(1);
        }

        // 6. Register shutdown hook
        final HttpServer httpServerRef = httpServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down Prediction Market Exchange...");
            httpServerRef.stop(1);
            httpExecutor.shutdown();

            statsLogger.logShutdownSummary();
            statsLogger.stop();

            metrics.close();
            logger.info("Prediction Market Exchange shut down complete.");
        }));

        logger.info("Prediction Market Exchange is ready. HTTP: {}, Metrics: {}",
                config.getHttpPort(), config.getMetricsPort());
    }
}
