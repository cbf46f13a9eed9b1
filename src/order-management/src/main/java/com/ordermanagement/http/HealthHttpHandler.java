package com.ordermanagement.http;

import com.google.gson.JsonObject;
import com.ordermanagement.config.ServiceConfig;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;

/**
 * HTTP handler for GET /health. Liveness only.
 */
public class HealthHttpHandler extends JsonHttpHandler {

    public HealthHttpHandler(ServiceConfig config) {
        super(config);
    }

    @Override
    protected void serve(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }

        JsonObject response = new JsonObject();
        response.addProperty("status", "healthy");
        response.addProperty("service", config.getServiceId());
        sendJson(exchange, 200, response);
    }
}
