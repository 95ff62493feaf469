package com.predictionmarket.http;

import com.predictionmarket.domain.BookEntry;
import com.predictionmarket.domain.OrderPlacement;
import com.predictionmarket.domain.OrderRequest;
import com.predictionmarket.engine.MatchingEngine;
import com.predictionmarket.logging.MatchingStats;
import com.predictionmarket.metrics.MetricsRegistry;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * HTTP handler for /orders.
 *
 * POST /orders validates the body, places the order synchronously and returns
 * the placement with its trades. Invalid requests never reach the engine.
 * GET /orders/{id} returns a resting order.
 */
public class OrderHttpHandler extends JsonHttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(OrderHttpHandler.class);
    private static final String CONTEXT = "/orders";

    private final MatchingEngine engine;
    private final MetricsRegistry metrics;
    private final MatchingStats stats;

    public OrderHttpHandler(MatchingEngine engine, MetricsRegistry metrics, MatchingStats stats,
                            String corsAllowedOrigin) {
        super(corsAllowedOrigin);
        this.engine = engine;
        this.metrics = metrics;
        this.stats = stats;
    }

    @Override
    protected void handleRequest(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String method = exchange.getRequestMethod();

        if (path.equals(CONTEXT) || path.equals(CONTEXT + "/")) {
            if (!"POST".equalsIgnoreCase(method)) {
                sendMethodNotAllowed(exchange);
                return;
            }
            placeOrder(exchange);
            return;
        }

        if (!path.startsWith(CONTEXT + "/")) {
            sendNotFound(exchange);
            return;
        }
        if (!"GET".equalsIgnoreCase(method)) {
            sendMethodNotAllowed(exchange);
            return;
        }
        lookupOrder(exchange, path.substring(CONTEXT.length() + 1));
    }

    private void placeOrder(HttpExchange exchange) throws IOException {
        OrderRequest request;
        try {
            request = OrderRequestParser.parse(readBody(exchange));
        } catch (OrderValidationException e) {
            metrics.ordersRejectedTotal.inc();
            stats.ordersRejected.incrementAndGet();
            logger.debug("Rejected order request: {}", e.getMessage());
            sendReject(exchange, e.getMessage());
            return;
        }

        OrderPlacement placement;
        try {
            placement = engine.place(request);
        } catch (RuntimeException e) {
            // Never retried, trades may already have executed
            logger.error("Engine failure placing order for account {}: {}",
                    request.accountId(), e.getMessage(), e);
            sendInternalError(exchange);
            return;
        }

        sendResponse(exchange, 200, EngineJson.placement(placement));
    }

    private void lookupOrder(HttpExchange exchange, String rawId) throws IOException {
        long orderId;
        try {
            orderId = Long.parseLong(rawId);
        } catch (NumberFormatException e) {
            sendReject(exchange, "Invalid order id: " + rawId);
            return;
        }

        Optional<BookEntry> entry = engine.lookup(orderId);
        if (entry.isEmpty()) {
            sendNotFound(exchange);
            return;
        }
        sendResponse(exchange, 200, EngineJson.entry(entry.get()));
    }
}
