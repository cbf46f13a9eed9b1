package com.ordermanagement.http;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ordermanagement.config.ServiceConfig;
import com.ordermanagement.domain.OrderBookSnapshot;
import com.ordermanagement.service.OrderManagementService;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.List;

/**
 * HTTP handler for GET /orderbook/{symbol}.
 * Lists both sides of the book in priority order; an unknown symbol gives empty lists.
 */
public class OrderBookHttpHandler extends JsonHttpHandler {

    private final OrderManagementService service;

    public OrderBookHttpHandler(OrderManagementService service, ServiceConfig config) {
        super(config);
        this.service = service;
    }

    @Override
    protected void serve(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }

        String path = exchange.getRequestURI().getPath();
        String symbol = validateSymbol(path.substring(path.lastIndexOf('/') + 1));

        OrderBookSnapshot snapshot = service.getOrderBook(symbol);

        JsonObject response = new JsonObject();
        response.addProperty("symbol", snapshot.symbol());
        response.add("buy_orders", toJson(snapshot.buyOrders()));
        response.add("sell_orders", toJson(snapshot.sellOrders()));
        sendJson(exchange, 200, response);
    }

    private static JsonArray toJson(List<OrderBookSnapshot.Entry> entries) {
        JsonArray array = new JsonArray();
        for (OrderBookSnapshot.Entry entry : entries) {
            JsonObject o = new JsonObject();
            o.addProperty("order_id", entry.orderId());
            o.addProperty("price", entry.price());
            o.addProperty("amount", entry.amount());
            array.add(o);
        }
        return array;
    }
}
