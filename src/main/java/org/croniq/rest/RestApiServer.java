package org.croniq.rest;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.handlers.PathHandler;
import org.croniq.config.XmlConfiguration;
import org.croniq.handlers.HealthCheckHandler;
import org.croniq.handlers.PingHandler;
import org.croniq.rest.base.Dispatcher;
import org.croniq.rest.base.FallBack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private final XmlConfiguration.Server cfg;
    private final PingHandler pingHandler;
    private final HealthCheckHandler healthCheckHandler;
    private Undertow server;

    public RestApiServer(XmlConfiguration.Server cfg, PingHandler pingHandler, HealthCheckHandler healthCheckHandler) {
        if (cfg == null) {
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }
        this.cfg = cfg;
        this.pingHandler = pingHandler;
        this.healthCheckHandler = healthCheckHandler;
    }

    public synchronized void start() {
        String basePath = normalize(cfg.basePath);

        PathHandler pathHandler = Handlers.path(new Dispatcher(new FallBack()))
                .addPrefixPath(basePath + "/webhook", Routes.webhook(pingHandler))
                .addPrefixPath(basePath + "/system", Routes.system(healthCheckHandler));

        server = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .setIoThreads(cfg.ioThreads)
                .setWorkerThreads(cfg.workerThreads)
                .addHttpListener(cfg.port, cfg.host)
                .setHandler(pathHandler)
                .build();

        try {
            server.start();
        } catch (RuntimeException e) {
            server = null;
            throw new IllegalStateException("Error starting server on " + cfg.host + ":" + cfg.port + ": " + e.getMessage(), e);
        }

        logger.info("""
                        \s
                        CRONIQ HEARTBEAT MONITOR
                        --------------------------------------
                        Undertow server started successfully!
                        Ping endpoint : POST http://{}:{}{}/webhook/ping/{token}
                        Health        : GET  http://{}:{}{}/system/health
                        """,
                cfg.host, port(), basePath, cfg.host, port(), basePath);
    }

    /** The bound port, which differs from the configured one when that was 0. */
    public synchronized int port() {
        if (server == null) {
            return cfg.port;
        }
        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        return address.getPort();
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            logger.info("Undertow server stopped.");
        }
    }

    static String normalize(String basePath) {
        if (basePath == null || basePath.isBlank() || "/".equals(basePath.trim())) {
            return "";
        }
        String path = basePath.trim();
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
