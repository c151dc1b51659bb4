package org.croniq.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;

/**
 * Moves the exchange off the IO thread onto an Undertow worker thread before {@code handler}
 * runs. Every handler that touches the database or the network goes through here.
 */
public class Dispatcher implements HttpHandler {
    private final HttpHandler handler;

    public Dispatcher(HttpHandler handler) {
        this.handler = handler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this.handler);
            return;
        }
        handler.handleRequest(exchange);
    }
}
