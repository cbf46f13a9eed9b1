package com.ordermanagement.http;

import com.google.gson.JsonObject;
import com.ordermanagement.config.ServiceConfig;
import com.ordermanagement.domain.Side;
import com.ordermanagement.service.OrderManagementService;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * HTTP handler for GET /price?symbol=..&side=..&amount=..
 * Answers {price} with the total cost of filling the amount.
 */
public class PriceHttpHandler extends JsonHttpHandler {

    private final OrderManagementService service;

    public PriceHttpHandler(OrderManagementService service, ServiceConfig config) {
        super(config);
        this.service = service;
    }

    @Override
    protected void serve(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }

        Map<String, String> params = parseQuery(exchange.getRequestURI().getRawQuery());
        String symbol = validateSymbol(requireParam(params, "symbol"));
        Side side = parseSide(requireParam(params, "side"));
        long amount = validateAmount(parseAmount(requireParam(params, "amount")));

        long price = service.calculatePrice(symbol, side, amount);

        JsonObject response = new JsonObject();
        response.addProperty("price", price);
        sendJson(exchange, 200, response);
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return params;
    }

    private static long parseAmount(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("amount must be an integer: " + value);
        }
    }

    private static String requireParam(Map<String, String> params, String name) {
        String value = params.get(name);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Missing query parameter: " + name);
        }
        return value;
    }
}
