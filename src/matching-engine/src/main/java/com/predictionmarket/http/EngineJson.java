package com.predictionmarket.http;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.predictionmarket.domain.BookEntry;
import com.predictionmarket.domain.MarketSnapshot;
import com.predictionmarket.domain.OrderPlacement;
import com.predictionmarket.domain.Trade;

import java.util.List;

/**
 * JSON shapes of the HTTP API. Field names are snake_case.
 */
final class EngineJson {

    private EngineJson() {
    }

    static JsonObject placement(OrderPlacement placement) {
        JsonObject json = new JsonObject();
        json.addProperty("order_id", placement.getOrderId());
        json.addProperty("status", placement.getStatus().name());
        json.addProperty("filled_quantity", placement.getFilledQuantity());
        json.addProperty("remaining_quantity", placement.getRemainingQuantity());
        json.add("trades", trades(placement.getTrades()));
        json.addProperty("message", placement.getMessage());
        return json;
    }

    static JsonArray trades(List<Trade> trades) {
        JsonArray array = new JsonArray();
        for (Trade trade : trades) {
            JsonObject json = new JsonObject();
            json.addProperty("trade_id", trade.getTradeId());
            json.addProperty("maker_order_id", trade.getMakerOrderId());
            json.addProperty("taker_order_id", trade.getTakerOrderId());
            json.addProperty("price", trade.getPrice());
            json.addProperty("quantity", trade.getQuantity());
            json.addProperty("side", trade.getSide().name());
            json.addProperty("timestamp", trade.getTimestamp());
            array.add(json);
        }
        return array;
    }

    static JsonObject snapshot(MarketSnapshot snapshot) {
        JsonObject json = new JsonObject();
        json.add("yes_bids", entries(snapshot.yesBids()));
        json.add("yes_asks", entries(snapshot.yesAsks()));
        json.add("no_bids", entries(snapshot.noBids()));
        json.add("no_asks", entries(snapshot.noAsks()));
        return json;
    }

    static JsonObject entry(BookEntry entry) {
        JsonObject json = new JsonObject();
        json.addProperty("order_id", entry.orderId());
        json.addProperty("price", entry.price());
        json.addProperty("quantity", entry.quantity());
        json.addProperty("account_id", entry.accountId());
        return json;
    }

    private static JsonArray entries(List<BookEntry> entries) {
        JsonArray array = new JsonArray();
        for (BookEntry entry : entries) {
            array.add(entry(entry));
        }
        return array;
    }
}
