package org.croniq.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.BlockingHandler;

public class RouteUtils {

    private RouteUtils() {}

    /**
     * Route that does not require authentication, run on a worker thread in blocking mode.
     * Ping clients authenticate with the unguessable token in the path.
     */
    public static HttpHandler publicRoute(HttpHandler handler) {
        return new Dispatcher(
                new BlockingHandler(handler)
        );
    }
}
