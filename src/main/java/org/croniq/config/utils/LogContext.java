package org.croniq.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helpers. Every request and background tick calls {@link #start} first and
 * {@link #clear} in a finally block, so log lines carry {@code component} and {@code trace.id}.
 */
public class LogContext {
    private LogContext() {}

    public static void start(String component) {
        MDC.put("component", component);
        MDC.put("trace.id", UUID.randomUUID().toString());
    }

    public static void clear() {
        MDC.clear();
    }
}
