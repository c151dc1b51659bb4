package org.croniq.services.tasks;

import org.croniq.config.utils.LogContext;
import org.croniq.monitoring.LateJobScanner;
import org.croniq.services.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic tick of the {@link LateJobScanner}. Ticks never overlap: the scheduler waits for a
 * run to finish before starting the next.
 */
public class LateJobScanTask implements ScheduledTask {

    private static final Logger logger = LoggerFactory.getLogger(LateJobScanTask.class);

    private final LateJobScanner scanner;
    private final long intervalSeconds;

    public LateJobScanTask(LateJobScanner scanner, long intervalSeconds) {
        this.scanner = scanner;
        this.intervalSeconds = intervalSeconds > 0 ? intervalSeconds : 60;
    }

    @Override
    public String name() {
        return "LateJobScanTask";
    }

    @Override
    public long intervalSeconds() {
        return intervalSeconds;
    }

    @Override
    public void execute() {
        LogContext.start("LateJobScanner");
        try {
            LateJobScanner.ScanSummary summary = scanner.scan();
            logger.debug("Scan tick finished: {}", summary);
        } finally {
            LogContext.clear();
        }
    }
}
