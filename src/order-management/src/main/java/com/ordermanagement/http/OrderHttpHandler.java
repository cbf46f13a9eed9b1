package com.ordermanagement.http;

import com.google.gson.JsonObject;
import com.ordermanagement.config.ServiceConfig;
import com.ordermanagement.domain.Order;
import com.ordermanagement.domain.Side;
import com.ordermanagement.service.OrderManagementService;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.time.Instant;

/**
 * HTTP handler for /orders.
 *
 * POST /orders with {order_id, symbol, side, amount, price} adds a resting order
 * and echoes it back with 201, including the acceptance time.
 * DELETE /orders/{id} removes one and answers 204.
 */
public class OrderHttpHandler extends JsonHttpHandler {

    private final OrderManagementService service;

    public OrderHttpHandler(OrderManagementService service, ServiceConfig config) {
        super(config);
        this.service = service;
    }

    @Override
    protected void serve(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();

        if ("POST".equalsIgnoreCase(method) && isCollection(path)) {
            addOrder(exchange);
        } else if ("DELETE".equalsIgnoreCase(method) && !isCollection(path)) {
            removeOrder(exchange, path);
        } else {
            sendMethodNotAllowed(exchange);
        }
    }

    private void addOrder(HttpExchange exchange) throws IOException {
        JsonObject json = readJsonObject(exchange);

        long orderId = requireLong(json, "order_id");
        String symbol = validateSymbol(requireString(json, "symbol"));
        Side side = parseSide(requireString(json, "side"));
        long amount = validateAmount(requireLong(json, "amount"));
        long price = validatePrice(requireLong(json, "price"));

        Order order = service.addOrder(orderId, symbol, side, amount, price);

        JsonObject response = new JsonObject();
        response.addProperty("order_id", order.getId().value());
        response.addProperty("symbol", order.getSymbol());
        response.addProperty("side", order.getSide().name());
        response.addProperty("amount", order.getOriginalAmount());
        response.addProperty("price", order.getPrice().cents());
        response.addProperty("accepted_at", Instant.ofEpochMilli(order.getAcceptedAt()).toString());
        sendJson(exchange, 201, response);
    }

    private void removeOrder(HttpExchange exchange, String path) throws IOException {
        String idSegment = path.substring(path.lastIndexOf('/') + 1);
        long orderId;
        try {
            orderId = Long.parseLong(idSegment);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid order id: " + idSegment);
        }
        service.removeOrder(orderId);
        sendNoContent(exchange);
    }

    private static boolean isCollection(String path) {
        return "/orders".equals(path) || "/orders/".equals(path);
    }
}
