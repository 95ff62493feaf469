package com.predictionmarket.http;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.predictionmarket.config.EngineConfig;
import com.predictionmarket.domain.OrderPlacement;
import com.predictionmarket.domain.OrderRequest;
import com.predictionmarket.domain.Side;
import com.predictionmarket.engine.MatchingEngine;
import com.predictionmarket.logging.MatchingStats;
import com.predictionmarket.metrics.MetricsRegistry;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeHttpServerTest {

    private MetricsRegistry metrics;
    private MatchingStats stats;
    private MatchingEngine engine;
    private ExecutorService executor;
    private HttpServer server;
    private HttpClient client;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        metrics = new MetricsRegistry(new PrometheusRegistry());
        stats = new MatchingStats();
        engine = new MatchingEngine(metrics, stats, false);
        executor = Executors.newFixedThreadPool(2);
        server = ExchangeHttpServer.create(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), executor,
                engine, metrics, stats, EngineConfig.defaults());
        server.start();
        baseUrl = "http://" + InetAddress.getLoopbackAddress().getHostAddress() + ":"
                + server.getAddress().getPort();
        client = HttpClient.newHttpClient();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> postOrder(String side, String type, int price, int qty, String account)
            throws Exception {
        return post("/orders", "{\"side\":\"" + side + "\",\"type\":\"" + type + "\",\"price\":" + price
                + ",\"quantity\":" + qty + ",\"account_id\":\"" + account + "\"}");
    }

    private static JsonObject object(HttpResponse<String> response) {
        return JsonParser.parseString(response.body()).getAsJsonObject();
    }

    @Test
    void placesOrderAndReturnsTrades() throws Exception {
        HttpResponse<String> first = postOrder("YES", "BUY", 60, 10, "alice");
        assertEquals(200, first.statusCode());
        JsonObject opened = object(first);
        assertEquals(1, opened.get("order_id").getAsLong());
        assertEquals("OPEN", opened.get("status").getAsString());
        assertEquals(10, opened.get("remaining_quantity").getAsLong());

        JsonObject filled = object(postOrder("NO", "SELL", 35, 5, "bob"));
        assertEquals("FILLED", filled.get("status").getAsString());
        assertEquals(5, filled.get("filled_quantity").getAsLong());
        assertEquals("Order 2: FILLED. Filled 5/5 shares in 1 trade(s).", filled.get("message").getAsString());

        JsonArray trades = filled.getAsJsonArray("trades");
        assertEquals(1, trades.size());
        JsonObject trade = trades.get(0).getAsJsonObject();
        assertEquals(1, trade.get("trade_id").getAsLong());
        assertEquals(1, trade.get("maker_order_id").getAsLong());
        assertEquals(2, trade.get("taker_order_id").getAsLong());
        assertEquals(60, trade.get("price").getAsInt());
        assertEquals(5, trade.get("quantity").getAsLong());
        assertEquals("NO", trade.get("side").getAsString());
    }

    @Test
    void invalidOrderIsRejectedBeforeTheEngine() throws Exception {
        HttpResponse<String> response = postOrder("YES", "BUY", 101, 1, "alice");

        assertEquals(400, response.statusCode());
        JsonObject body = object(response);
        assertEquals("REJECTED", body.get("status").getAsString());
        assertTrue(body.get("detail").getAsString().contains("price"));
        assertEquals(0, engine.restingOrderCount(Side.YES));
        assertEquals(1.0, metrics.ordersRejectedTotal.get());
        assertEquals(1, stats.ordersRejected.get());

        assertEquals(400, postOrder("YES", "BUY", 50, 0, "alice").statusCode());
        assertEquals(400, post("/orders", "not json").statusCode());
    }

    @Test
    void orderBookShowsFourSides() throws Exception {
        postOrder("YES", "BUY", 60, 10, "alice");
        postOrder("YES", "SELL", 70, 3, "bob");

        JsonObject book = object(get("/orderbook"));
        JsonArray yesBids = book.getAsJsonArray("yes_bids");
        assertEquals(1, yesBids.size());
        JsonObject entry = yesBids.get(0).getAsJsonObject();
        assertEquals(1, entry.get("order_id").getAsLong());
        assertEquals(60, entry.get("price").getAsInt());
        assertEquals(10, entry.get("quantity").getAsLong());
        assertEquals("alice", entry.get("account_id").getAsString());

        assertEquals(70, book.getAsJsonArray("yes_asks").get(0).getAsJsonObject().get("price").getAsInt());
        assertEquals(1, book.getAsJsonArray("no_bids").size());
        assertEquals(0, book.getAsJsonArray("no_asks").size());
    }

    @Test
    void tradesHonourLimitAndOrder() throws Exception {
        postOrder("YES", "BUY", 50, 10, "alice");
        for (int i = 0; i < 3; i++) {
            postOrder("NO", "SELL", 40, 1, "bob");
        }

        JsonArray all = JsonParser.parseString(get("/trades").body()).getAsJsonArray();
        assertEquals(3, all.size());
        assertEquals(3, all.get(0).getAsJsonObject().get("trade_id").getAsLong());

        JsonArray limited = JsonParser.parseString(get("/trades?limit=2").body()).getAsJsonArray();
        assertEquals(2, limited.size());

        assertEquals(400, get("/trades?limit=abc").statusCode());
        assertEquals(400, get("/trades?limit=-1").statusCode());
    }

    @Test
    void lookupReturnsRestingOrder() throws Exception {
        postOrder("NO", "BUY", 45, 7, "carol");

        HttpResponse<String> found = get("/orders/1");
        assertEquals(200, found.statusCode());
        assertEquals(7, object(found).get("quantity").getAsLong());

        assertEquals(404, get("/orders/99").statusCode());
        assertEquals(400, get("/orders/abc").statusCode());
    }

    @Test
    void resetClearsState() throws Exception {
        postOrder("YES", "BUY", 60, 10, "alice");

        HttpResponse<String> reset = post("/reset", "");
        assertEquals(200, reset.statusCode());
        assertEquals("Order book reset successfully", object(reset).get("message").getAsString());

        JsonObject book = object(get("/orderbook"));
        assertEquals(0, book.getAsJsonArray("yes_bids").size());
        JsonElement trades = JsonParser.parseString(get("/trades").body());
        assertEquals(0, trades.getAsJsonArray().size());
        assertEquals(1, object(postOrder("YES", "BUY", 60, 1, "alice")).get("order_id").getAsLong());
    }

    @Test
    void rootAndHealthEndpoints() throws Exception {
        JsonObject root = object(get("/"));
        assertEquals("Prediction Market Exchange API", root.get("message").getAsString());
        assertEquals("running", root.get("status").getAsString());

        assertEquals("UP", object(get("/health")).get("status").getAsString());
        assertEquals(404, get("/nope").statusCode());
    }

    @Test
    void wrongMethodIsRejected() throws Exception {
        assertEquals(405, get("/orders").statusCode());
        assertEquals(405, get("/reset").statusCode());
        assertEquals(405, post("/orderbook", "").statusCode());
    }

    @Test
    void engineFailureReturnsGenericServerError() throws Exception {
        MatchingEngine failing = new MatchingEngine(metrics, stats, false) {
            @Override
            public OrderPlacement place(OrderRequest request) {
                throw new IllegalStateException("book invariant broken");
            }
        };
        HttpServer failingServer = ExchangeHttpServer.create(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), executor,
                failing, metrics, stats, EngineConfig.defaults());
        failingServer.start();
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create("http://"
                            + InetAddress.getLoopbackAddress().getHostAddress() + ":"
                            + failingServer.getAddress().getPort() + "/orders"))
                    .POST(HttpRequest.BodyPublishers.ofString("{\"side\":\"YES\",\"type\":\"BUY\","
                            + "\"price\":60,\"quantity\":1,\"account_id\":\"alice\"}"))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertEquals(500, response.statusCode());
            JsonObject body = object(response);
            assertEquals("ERROR", body.get("status").getAsString());
            assertEquals("Internal error", body.get("detail").getAsString());
            assertFalse(response.body().contains("book invariant broken"));
            assertEquals(0.0, metrics.ordersRejectedTotal.get());
            assertEquals(0, stats.ordersRejected.get());
        } finally {
            failingServer.stop(0);
        }
    }

    @Test
    void corsHeadersAndPreflight() throws Exception {
        HttpResponse<String> response = get("/orderbook");
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));

        HttpRequest preflight = HttpRequest.newBuilder(URI.create(baseUrl + "/orders"))
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<String> preflightResponse = client.send(preflight, HttpResponse.BodyHandlers.ofString());
        assertEquals(204, preflightResponse.statusCode());
        assertTrue(preflightResponse.headers().firstValue("Access-Control-Allow-Methods")
                .orElse("").contains("POST"));
    }
}
