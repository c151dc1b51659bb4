package org.croniq.rest;

import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import org.croniq.handlers.HealthCheckHandler;
import org.croniq.handlers.PingHandler;
import org.croniq.rest.base.Dispatcher;
import org.croniq.rest.base.FallBack;
import org.croniq.rest.base.InvalidMethod;

import static org.croniq.rest.base.RouteUtils.publicRoute;

public class Routes {

    private Routes() {}

    public static RoutingHandler webhook(PingHandler pingHandler) {
        return Handlers.routing()
                .post("/ping/{token}", publicRoute(pingHandler))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }

    public static RoutingHandler system(HealthCheckHandler healthCheckHandler) {
        return Handlers.routing()
                .get("/health", publicRoute(healthCheckHandler))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }
}
