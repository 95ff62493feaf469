package com.predictionmarket.http;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.predictionmarket.domain.OrderRequest;
import com.predictionmarket.domain.OrderType;
import com.predictionmarket.domain.Side;
import com.predictionmarket.matching.OrderNormalizer;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Parses and validates the JSON body of POST /orders:
 * {@code {"side":"YES","type":"BUY","price":60,"quantity":10,"account_id":"alice"}}.
 *
 * A single range check covers price for both BUY and SELL.
 */
public final class OrderRequestParser {

    private OrderRequestParser() {
    }

    public static OrderRequest parse(String body) throws OrderValidationException {
        JsonObject json;
        try {
            JsonElement element = JsonParser.parseString(body);
            if (!element.isJsonObject()) {
                throw new OrderValidationException("Request body must be a JSON object");
            }
            json = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new OrderValidationException("Malformed JSON: " + e.getMessage());
        }

        Side side = parseEnum(Side.class, requireString(json, "side"), "side");
        OrderType type = parseEnum(OrderType.class, requireString(json, "type"), "type");

        BigDecimal rawPrice = requireNumber(json, "price");
        int price;
        try {
            price = rawPrice.intValueExact();
        } catch (ArithmeticException e) {
            throw new OrderValidationException("price must be an integer: " + rawPrice);
        }
        if (price < OrderNormalizer.MIN_PRICE || price > OrderNormalizer.MAX_PRICE) {
            throw new OrderValidationException("price must be between "
                    + OrderNormalizer.MIN_PRICE + " and " + OrderNormalizer.MAX_PRICE + ": " + price);
        }

        BigDecimal rawQuantity = requireNumber(json, "quantity");
        long quantity;
        try {
            quantity = rawQuantity.longValueExact();
        } catch (ArithmeticException e) {
            throw new OrderValidationException("quantity must be an integer: " + rawQuantity);
        }
        if (quantity < 1) {
            throw new OrderValidationException("quantity must be at least 1: " + quantity);
        }

        String accountId = requireString(json, "account_id");
        if (accountId.isBlank()) {
            throw new OrderValidationException("account_id must not be blank");
        }

        return new OrderRequest(side, type, price, quantity, accountId);
    }

    private static String requireString(JsonObject json, String field) throws OrderValidationException {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            throw new OrderValidationException(field + " is required");
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new OrderValidationException(field + " must be a string");
        }
        return element.getAsString();
    }

    private static BigDecimal requireNumber(JsonObject json, String field) throws OrderValidationException {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            throw new OrderValidationException(field + " is required");
        }
        if (!element.isJsonPrimitive()) {
            throw new OrderValidationException(field + " must be a number");
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (!primitive.isNumber()) {
            throw new OrderValidationException(field + " must be a number");
        }
        try {
            return primitive.getAsBigDecimal();
        } catch (NumberFormatException e) {
            throw new OrderValidationException(field + " must be a number");
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field)
            throws OrderValidationException {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new OrderValidationException("Invalid " + field + ": " + value);
        }
    }
}
