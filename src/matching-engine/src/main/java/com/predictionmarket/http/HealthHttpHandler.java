package com.predictionmarket.http;

import com.google.gson.JsonObject;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;

/**
 * HTTP handler for GET / and GET /health. Any other path under the root
 * context is answered with 404.
 */
public class HealthHttpHandler extends JsonHttpHandler {

    public HealthHttpHandler(String corsAllowedOrigin) {
        super(corsAllowedOrigin);
    }

    @Override
    protected void handleRequest(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (!path.equals("/") && !path.equals("/health")) {
            sendNotFound(exchange);
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }

        JsonObject response = new JsonObject();
        if (path.equals("/health")) {
            response.addProperty("status", "UP");
        } else {
            response.addProperty("message", "Prediction Market Exchange API");
            response.addProperty("status", "running");
        }
        sendResponse(exchange, 200, response);
    }
}
