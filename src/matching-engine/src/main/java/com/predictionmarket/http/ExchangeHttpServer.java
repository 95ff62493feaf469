package com.predictionmarket.http;

import com.predictionmarket.config.EngineConfig;
import com.predictionmarket.engine.MatchingEngine;
import com.predictionmarket.logging.MatchingStats;
import com.predictionmarket.metrics.MetricsRegistry;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.Executor;

/**
 * Wires the exchange endpoints onto a JDK {@link HttpServer}.
 */
public final class ExchangeHttpServer {

    private ExchangeHttpServer() {
    }

    /**
     * Create (but do not start) a server bound to {@code address}.
     */
    public static HttpServer create(InetSocketAddress address, Executor executor,
                                    MatchingEngine engine, MetricsRegistry metrics,
                                    MatchingStats stats, EngineConfig config) throws IOException {
        String origin = config.getCorsAllowedOrigin();
        HttpServer httpServer = HttpServer.create(address, 0);
        httpServer.createContext("/orders",
                new OrderHttpHandler(engine, metrics, stats, origin));
        httpServer.createContext("/orderbook",
                new OrderBookHttpHandler(engine, config.getBookDepth(), origin));
        httpServer.createContext("/trades",
                new TradesHttpHandler(engine, config.getDefaultTradeLimit(), origin));
        httpServer.createContext("/reset",
                new ResetHttpHandler(engine, origin));
        httpServer.createContext("/",
                new HealthHttpHandler(origin));
        httpServer.setExecutor(executor);
        return httpServer;
    }
}
