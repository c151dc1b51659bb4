package org.croniq.notifications;

import org.croniq.monitoring.JobExecution;
import org.croniq.monitoring.MonitoredJob;
import org.croniq.store.NotificationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a job event out to every bound, verified channel whose trigger flag matches.
 *
 * Sends run on the worker pool and share one deadline, so a hung transport cannot hold up
 * the other channels of the same event. Nothing thrown by a sender or by the binding lookup
 * escapes {@link #dispatch}.
 */
public class NotificationDispatcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationStore store;
    private final Map<ChannelType, NotificationSender> senders = new EnumMap<>(ChannelType.class);
    private final ExecutorService workers;
    private final Duration sendTimeout;
    private final Clock clock;

    public NotificationDispatcher(NotificationStore store, ExecutorService workers, Duration sendTimeout, Clock clock) {
        this.store = store;
        this.workers = workers;
        this.sendTimeout = sendTimeout;
        this.clock = clock;
    }

    public void addSender(NotificationSender sender) {
        senders.put(sender.channelType(), sender);
    }

    public DispatchReport dispatch(MonitoredJob job, EventKind kind, JobExecution execution) {
        List<ChannelBinding> bindings;
        try {
            bindings = store.findVerifiedBindings(job.id());
        } catch (RuntimeException e) {
            logger.error("Could not load notification bindings for job {} ({}), {} alert dropped",
                    job.id(), job.name(), kind, e);
            return DispatchReport.EMPTY;
        }
        if (bindings.isEmpty()) {
            logger.debug("Job {} has no verified channels for {}", job.id(), kind);
            return DispatchReport.EMPTY;
        }

        NotificationPayload payload = NotificationPayload.of(job, kind, execution, clock.instant());
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        int skipped = 0;
        int failed = 0;
        List<PendingSend> pending = new ArrayList<>();

        for (ChannelBinding binding : bindings) {
            NotificationChannel channel = binding.channel();
            if (!channel.verified()) {
                logger.debug("Channel {} ({}) is not verified, skipping", channel.id(), channel.name());
                skipped++;
                continue;
            }
            if (!binding.setting().triggersOn(kind)) {
                skipped++;
                continue;
            }
            NotificationSender sender = senders.get(channel.type());
            if (sender == null) {
                logger.warn("No sender registered for channel type {} (channel {})", channel.type(), channel.id());
                skipped++;
                continue;
            }

            try {
                Future<Boolean> future = workers.submit(() -> sendWithContext(mdc, sender, channel, payload));
                pending.add(new PendingSend(channel, future));
            } catch (RejectedExecutionException e) {
                logger.error("Notification workers rejected {} alert for job {} via channel {}",
                        kind, job.id(), channel.id(), e);
                failed++;
            }
        }

        int delivered = 0;
        long deadline = System.nanoTime() + sendTimeout.toNanos();
        for (PendingSend send : pending) {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                if (Boolean.TRUE.equals(send.future().get(remaining, TimeUnit.NANOSECONDS))) {
                    delivered++;
                } else {
                    failed++;
                    logger.warn("Channel {} ({}) did not accept {} alert for job {}",
                            send.channel().id(), send.channel().type(), kind, job.id());
                }
            } catch (TimeoutException e) {
                send.future().cancel(true);
                failed++;
                logger.warn("Channel {} ({}) timed out after {} ms sending {} alert for job {}",
                        send.channel().id(), send.channel().type(), sendTimeout.toMillis(), kind, job.id());
            } catch (ExecutionException e) {
                failed++;
                logger.error("Failed to dispatch {} alert for job {} via channel {} ({})",
                        kind, job.id(), send.channel().id(), send.channel().type(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                send.future().cancel(true);
                failed++;
                logger.warn("Interrupted while dispatching {} alert for job {}", kind, job.id());
            }
        }

        DispatchReport report = new DispatchReport(delivered, failed, skipped);
        logger.info("Dispatched {} alert for job {} ({}): delivered={}, failed={}, skipped={}",
                kind, job.id(), job.name(), report.delivered(), report.failed(), report.skipped());
        return report;
    }

    private static Boolean sendWithContext(Map<String, String> mdc, NotificationSender sender,
                                           NotificationChannel channel, NotificationPayload payload) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            return sender.send(channel, payload);
        } finally {
            MDC.clear();
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private record PendingSend(NotificationChannel channel, Future<Boolean> future) {
    }
}
