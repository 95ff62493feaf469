package com.predictionmarket.http;

import com.predictionmarket.engine.MatchingEngine;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;

/**
 * HTTP handler for GET /trades?limit=N. Most recent trade first.
 */
public class TradesHttpHandler extends JsonHttpHandler {

    private final MatchingEngine engine;
    private final int defaultLimit;

    public TradesHttpHandler(MatchingEngine engine, int defaultLimit, String corsAllowedOrigin) {
        super(corsAllowedOrigin);
        this.engine = engine;
        this.defaultLimit = defaultLimit;
    }

    @Override
    protected void handleRequest(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }

        int limit = defaultLimit;
        String rawLimit = queryParam(exchange.getRequestURI().getRawQuery(), "limit");
        if (rawLimit != null) {
            try {
                limit = Integer.parseInt(rawLimit);
            } catch (NumberFormatException e) {
                sendReject(exchange, "limit must be an integer: " + rawLimit);
                return;
            }
            if (limit < 0) {
                sendReject(exchange, "limit must not be negative: " + limit);
                return;
            }
        }

        sendResponse(exchange, 200, EngineJson.trades(engine.recentTrades(limit)));
    }

    private static String queryParam(String query, String name) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eqIdx = pair.indexOf('=');
            String key = eqIdx >= 0 ? pair.substring(0, eqIdx) : pair;
            if (key.equals(name)) {
                return eqIdx >= 0 ? pair.substring(eqIdx + 1) : "";
            }
        }
        return null;
    }
}
