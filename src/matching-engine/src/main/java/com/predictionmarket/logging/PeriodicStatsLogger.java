package com.predictionmarket.logging;

import com.predictionmarket.domain.Side;
import com.predictionmarket.engine.MatchingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Logs aggregate matching statistics every N seconds on a separate daemon thread.
 */
public class PeriodicStatsLogger {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicStatsLogger.class);

    private final MatchingStats stats;
    private final MatchingEngine engine;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private long lastYesOrders;
    private long lastNoOrders;
    private long lastTrades;
    private long lastShares;
    private long lastRejected;

    public PeriodicStatsLogger(MatchingStats stats, MatchingEngine engine, int intervalSeconds) {
        this.stats = stats;
        this.engine = engine;
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
        long totalYes = stats.yesOrdersReceived.get();
        long totalNo = stats.noOrdersReceived.get();
        long totalOrders = totalYes + totalNo;

        logger.info("Shutdown summary",
                keyValue("event", "SHUTDOWN_SUMMARY"),
                keyValue("totalYesOrders", totalYes),
                keyValue("totalNoOrders", totalNo),
                keyValue("totalOrders", totalOrders),
                keyValue("totalTrades", stats.tradesExecuted.get()),
                keyValue("totalSharesTraded", stats.sharesTraded.get()),
                keyValue("totalRejected", stats.ordersRejected.get()));
    }

    private void logSummary() {
        try {
            long currentYes = stats.yesOrdersReceived.get();
            long currentNo = stats.noOrdersReceived.get();
            long currentTrades = stats.tradesExecuted.get();
            long currentShares = stats.sharesTraded.get();
            long currentRejected = stats.ordersRejected.get();

            long deltaYes = currentYes - lastYesOrders;
            long deltaNo = currentNo - lastNoOrders;
            long deltaTrades = currentTrades - lastTrades;
            long deltaShares = currentShares - lastShares;
            long deltaRejected = currentRejected - lastRejected;

            lastYesOrders = currentYes;
            lastNoOrders = currentNo;
            lastTrades = currentTrades;
            lastShares = currentShares;
            lastRejected = currentRejected;

            logger.info("Periodic summary",
                    keyValue("event", "PERIODIC_SUMMARY"),
                    keyValue("intervalSeconds", intervalSeconds),
                    keyValue("yesOrders", deltaYes),
                    keyValue("noOrders", deltaNo),
                    keyValue("totalOrders", deltaYes + deltaNo),
                    keyValue("tradesExecuted", deltaTrades),
                    keyValue("sharesTraded", deltaShares),
                    keyValue("rejected", deltaRejected),
                    keyValue("yesBookDepth", engine.restingOrderCount(Side.YES)),
                    keyValue("noBookDepth", engine.restingOrderCount(Side.NO)));
        } catch (Exception e) {
            logger.error("Error in periodic stats logging", e);
        }
    }
}
