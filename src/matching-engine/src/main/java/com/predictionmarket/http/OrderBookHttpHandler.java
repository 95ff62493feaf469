package com.predictionmarket.http;

import com.predictionmarket.engine.MatchingEngine;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;

/**
 * HTTP handler for GET /orderbook. Returns the four-sided snapshot.
 */
public class OrderBookHttpHandler extends JsonHttpHandler {

    private final MatchingEngine engine;
    private final int depth;

    public OrderBookHttpHandler(MatchingEngine engine, int depth, String corsAllowedOrigin) {
        super(corsAllowedOrigin);
        this.engine = engine;
        this.depth = depth;
    }

    @Override
    protected void handleRequest(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }
        sendResponse(exchange, 200, EngineJson.snapshot(engine.snapshot(depth)));
    }
}
