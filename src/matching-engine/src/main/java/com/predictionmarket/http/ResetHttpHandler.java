package com.predictionmarket.http;

import com.google.gson.JsonObject;
import com.predictionmarket.engine.MatchingEngine;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * HTTP handler for POST /reset.
 *
 * Discards every resting order and trade. For test setups only.
 */
public class ResetHttpHandler extends JsonHttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(ResetHttpHandler.class);

    private final MatchingEngine engine;

    public ResetHttpHandler(MatchingEngine engine, String corsAllowedOrigin) {
        super(corsAllowedOrigin);
        this.engine = engine;
    }

    @Override
    protected void handleRequest(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }

        engine.reset();
        logger.info("Order book reset via HTTP from {}", exchange.getRemoteAddress());

        JsonObject response = new JsonObject();
        response.addProperty("message", "Order book reset successfully");
        sendResponse(exchange, 200, response);
    }
}
