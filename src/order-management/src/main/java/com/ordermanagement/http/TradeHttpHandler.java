package com.ordermanagement.http;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ordermanagement.config.ServiceConfig;
import com.ordermanagement.domain.OrderFill;
import com.ordermanagement.domain.Side;
import com.ordermanagement.domain.Trade;
import com.ordermanagement.service.OrderManagementService;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;

/**
 * HTTP handler for POST /trades with {symbol, side, amount}.
 * Answers 201 with the executed trade and the fills it consumed.
 */
public class TradeHttpHandler extends JsonHttpHandler {

    private final OrderManagementService service;

    public TradeHttpHandler(OrderManagementService service, ServiceConfig config) {
        super(config);
        this.service = service;
    }

    @Override
    protected void serve(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }

        JsonObject json = readJsonObject(exchange);
        String symbol = validateSymbol(requireString(json, "symbol"));
        Side side = parseSide(requireString(json, "side"));
        long amount = validateAmount(requireLong(json, "amount"));

        Trade trade = service.placeTrade(symbol, side, amount);
        sendJson(exchange, 201, toJson(trade));
    }

    static JsonObject toJson(Trade trade) {
        JsonArray fills = new JsonArray();
        for (OrderFill fill : trade.getOrderFills()) {
            JsonObject f = new JsonObject();
            f.addProperty("order_id", fill.orderId());
            f.addProperty("filled_amount", fill.filledAmount());
            f.addProperty("fill_price", fill.fillPrice());
            fills.add(f);
        }

        JsonObject response = new JsonObject();
        response.addProperty("trade_id", trade.getTradeId());
        response.addProperty("symbol", trade.getSymbol());
        response.addProperty("side", trade.getSide().name());
        response.addProperty("amount", trade.getAmount());
        response.addProperty("total_price", trade.getTotalPrice());
        response.addProperty("executed_at", trade.getExecutedAt().toString());
        response.add("order_fills", fills);
        return response;
    }
}
