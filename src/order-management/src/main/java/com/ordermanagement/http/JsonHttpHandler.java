package com.ordermanagement.http;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ordermanagement.config.ServiceConfig;
import com.ordermanagement.domain.Side;
import com.ordermanagement.exception.DuplicateOrderException;
import com.ordermanagement.exception.InsufficientLiquidityException;
import com.ordermanagement.exception.OrderManagementException;
import com.ordermanagement.exception.OrderNotFoundException;
import com.ordermanagement.exception.UnknownSymbolException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Shared plumbing for the JSON endpoints: body reading, wire-level validation,
 * response writing, and translation of core failures into HTTP statuses.
 *
 * Status mapping:
 * InvalidOrder / InvalidRequest -> 400, NotFound / UnknownSymbol -> 404,
 * DuplicateOrder -> 409, InsufficientLiquidity -> 422,
 * malformed or incomplete request -> 400, anything else -> 500.
 */
abstract class JsonHttpHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(JsonHttpHandler.class);
    private static final Pattern SYMBOL = Pattern.compile("^[A-Z]{1,10}$");

    protected final Gson gson = new Gson();
    protected final ServiceConfig config;

    protected JsonHttpHandler(ServiceConfig config) {
        this.config = config;
    }

    /**
     * Serve one request. Core and wire failures thrown from here are mapped
     * to a JSON error response by {@link #handle}.
     */
    protected abstract void serve(HttpExchange exchange) throws IOException;

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            serve(exchange);
        } catch (OrderManagementException e) {
            int status = statusFor(e);
            logger.warn("Rejected {} {} with {}: {}", exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(), status, e.getMessage());
            sendError(exchange, status, e.getMessage());
        } catch (JsonParseException | IllegalArgumentException
                 | IllegalStateException | UnsupportedOperationException e) {
            logger.warn("Bad request {} {}: {}", exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(), e.getMessage());
            sendError(exchange, 400, e.getMessage());
        } catch (Exception e) {
            logger.error("Error handling {} {}: {}", exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(), e.getMessage(), e);
            sendError(exchange, 500, "Internal error");
        } finally {
            exchange.close();
        }
    }

    static int statusFor(OrderManagementException e) {
        if (e instanceof OrderNotFoundException || e instanceof UnknownSymbolException) {
            return 404;
        }
        if (e instanceof DuplicateOrderException) {
            return 409;
        }
        if (e instanceof InsufficientLiquidityException) {
            return 422;
        }
        return 400;
    }

    protected JsonObject readJsonObject(HttpExchange exchange) throws IOException {
        String body;
        try (InputStream is = exchange.getRequestBody()) {
            body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        JsonElement element = JsonParser.parseString(body);
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        return element.getAsJsonObject();
    }

    protected static long requireLong(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull()) {
            throw new IllegalArgumentException("Missing field: " + field);
        }
        try {
            return value.getAsBigDecimal().longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(field + " must be an integer: " + value);
        }
    }

    protected static String requireString(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull()) {
            throw new IllegalArgumentException("Missing field: " + field);
        }
        return value.getAsString();
    }

    protected static Side parseSide(String value) {
        try {
            return Side.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid side: " + value + " (valid values: BUY, SELL)");
        }
    }

    protected static String validateSymbol(String symbol) {
        if (!SYMBOL.matcher(symbol).matches()) {
            throw new IllegalArgumentException("Invalid symbol: " + symbol);
        }
        return symbol;
    }

    protected long validateAmount(long amount) {
        if (amount > config.getMaxOrderAmount()) {
            throw new IllegalArgumentException(
                    "Amount " + amount + " exceeds maximum " + config.getMaxOrderAmount());
        }
        return amount;
    }

    protected long validatePrice(long price) {
        if (price > config.getMaxOrderPrice()) {
            throw new IllegalArgumentException(
                    "Price " + price + " exceeds maximum " + config.getMaxOrderPrice());
        }
        return price;
    }

    protected void sendJson(HttpExchange exchange, int statusCode, JsonElement body)
            throws IOException {
        sendResponse(exchange, statusCode, gson.toJson(body));
    }

    protected void sendNoContent(HttpExchange exchange) throws IOException {
        exchange.sendResponseHeaders(204, -1);
    }

    protected void sendMethodNotAllowed(HttpExchange exchange) throws IOException {
        sendError(exchange, 405, "Method not allowed");
    }

    protected void sendError(HttpExchange exchange, int statusCode, String message)
            throws IOException {
        JsonObject response = new JsonObject();
        response.addProperty("error", message);
        sendJson(exchange, statusCode, response);
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body)
            throws IOException {
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
