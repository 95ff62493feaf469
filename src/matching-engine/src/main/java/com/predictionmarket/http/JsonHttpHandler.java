package com.predictionmarket.http;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Base for the JSON endpoints. Adds CORS headers to every response and answers
 * OPTIONS preflight requests before dispatching to {@link #handleRequest}.
 */
abstract class JsonHttpHandler implements HttpHandler {

    private final Gson gson = new Gson();
    private final String corsAllowedOrigin;

    protected JsonHttpHandler(String corsAllowedOrigin) {
        this.corsAllowedOrigin = corsAllowedOrigin;
    }

    @Override
    public final void handle(HttpExchange exchange) throws IOException {
        try {
            if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
                addCorsHeaders(exchange);
                exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
                exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
                exchange.sendResponseHeaders(204, -1);
                return;
            }
            handleRequest(exchange);
        } finally {
            exchange.close();
        }
    }

    protected abstract void handleRequest(HttpExchange exchange) throws IOException;

    protected String readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    protected void sendMethodNotAllowed(HttpExchange exchange) throws IOException {
        sendError(exchange, 405, "error", "Method not allowed");
    }

    protected void sendNotFound(HttpExchange exchange) throws IOException {
        sendError(exchange, 404, "error", "Not found");
    }

    protected void sendReject(HttpExchange exchange, String detail) throws IOException {
        JsonObject response = new JsonObject();
        response.addProperty("status", "REJECTED");
        response.addProperty("detail", detail);
        sendResponse(exchange, 400, response);
    }

    protected void sendInternalError(HttpExchange exchange) throws IOException {
        JsonObject response = new JsonObject();
        response.addProperty("status", "ERROR");
        response.addProperty("detail", "Internal error");
        sendResponse(exchange, 500, response);
    }

    private void sendError(HttpExchange exchange, int statusCode, String field, String message)
            throws IOException {
        JsonObject response = new JsonObject();
        response.addProperty(field, message);
        sendResponse(exchange, statusCode, response);
    }

    protected void sendResponse(HttpExchange exchange, int statusCode, JsonElement body)
            throws IOException {
        byte[] responseBytes = gson.toJson(body).getBytes(StandardCharsets.UTF_8);
        addCorsHeaders(exchange);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }

    private void addCorsHeaders(HttpExchange exchange) {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", corsAllowedOrigin);
    }
}
