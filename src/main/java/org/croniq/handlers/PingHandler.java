package org.croniq.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.croniq.config.utils.LogContext;
import org.croniq.errors.NotFoundException;
import org.croniq.monitoring.MonitoredJob;
import org.croniq.monitoring.PingIngestor;
import org.croniq.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code POST /webhook/ping/{token}}. Any POST counts as a successful run; the body is not read.
 */
public class PingHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(PingHandler.class);

    private final PingIngestor ingestor;

    public PingHandler(PingIngestor ingestor) {
        this.ingestor = ingestor;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        LogContext.start("PingHandler");
        try {
            Deque<String> tokenParam = exchange.getQueryParameters().get("token");
            String token = tokenParam != null ? tokenParam.peekFirst() : null;

            PingIngestor.PingResult result = ingestor.processPing(token);
            ResponseUtil.sendSuccess(exchange, "Ping processed successfully.", toView(result.job()));

        } catch (NotFoundException e) {
            ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Failed to process ping: {}", e.getMessage(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to process ping.");
        } finally {
            LogContext.clear();
        }
    }

    static Map<String, Object> toView(MonitoredJob job) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", job.id());
        view.put("name", job.name());
        view.put("schedule_type", job.scheduleType().code());
        view.put("schedule", job.scheduleValue());
        view.put("status", job.status().code());
        view.put("grace_period_seconds", job.gracePeriodSeconds());
        view.put("last_pinged_at", job.lastPingedAt() != null ? job.lastPingedAt().toString() : null);
        view.put("expected_next_ping_at", job.expectedNextPingAt() != null ? job.expectedNextPingAt().toString() : null);
        return view;
    }
}
