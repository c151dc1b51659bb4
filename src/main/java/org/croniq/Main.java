package org.croniq;

import org.croniq.config.ConfigLoader;
import org.croniq.config.KeyProvider;
import org.croniq.config.XmlConfiguration;
import org.croniq.config.database.DatabaseManager;
import org.croniq.config.database.SchemaInitializer;
import org.croniq.config.utils.LogContext;
import org.croniq.handlers.HealthCheckHandler;
import org.croniq.handlers.PingHandler;
import org.croniq.monitoring.LateJobScanner;
import org.croniq.monitoring.PingIngestor;
import org.croniq.monitoring.ScheduleCalculator;
import org.croniq.notifications.JsonHttpPoster;
import org.croniq.notifications.NotificationDispatcher;
import org.croniq.notifications.TemplateLoader;
import org.croniq.notifications.email.EmailSender;
import org.croniq.notifications.pagerduty.PagerDutySender;
import org.croniq.notifications.slack.SlackSender;
import org.croniq.notifications.webhook.WebhookSender;
import org.croniq.rest.RestApiServer;
import org.croniq.services.TaskScheduler;
import org.croniq.store.JobStore;
import org.croniq.store.NotificationStore;
import org.croniq.store.jdbc.JdbcJobStore;
import org.croniq.store.jdbc.JdbcNotificationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.croniq.services.ApplicationTasks.registerApplicationTasks;

/**
 * Entry point
 * Load configuration from XML
 * Open the connection pool
 * Wire the monitoring engine and start the scanner and the ping endpoint
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        KeyProvider.initLogging();
        LogContext.start("Main");

        try {
            logger.info("[------------ Starting Croniq ------------]");

            String configPath = (args.length > 0) ? args[0] : "config.xml";
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            logger.debug("Configuration loaded from {}", configPath);

            Clock clock = Clock.systemUTC();

            DatabaseManager database = new DatabaseManager(cfg);
            if (database.isAvailable()) {
                logger.info("Database connection successful!");
                if (cfg.dataSource.initializeSchema) {
                    SchemaInitializer.apply(database.getDataSource());
                }
            } else {
                logger.warn("[------------ Continuing in DEGRADED MODE, database unavailable ------------]");
            }

            JobStore jobStore = new JdbcJobStore(database.getDataSource());
            NotificationStore notificationStore = new JdbcNotificationStore(database.getDataSource());

            ScheduleCalculator calculator = new ScheduleCalculator(clock, cronZone(cfg));
            NotificationDispatcher dispatcher = buildDispatcher(cfg, notificationStore, clock);

            PingIngestor ingestor = new PingIngestor(jobStore, calculator, dispatcher, clock,
                    cfg.monitoring.pingRetryAttempts);
            LateJobScanner scanner = new LateJobScanner(jobStore, calculator, dispatcher, clock,
                    cfg.monitoring.escalationMultiplier);

            TaskScheduler scheduler = new TaskScheduler(1, clock);
            registerApplicationTasks(scheduler, scanner, cfg);

            logger.info("[------------ Starting Undertow server ------------]");
            RestApiServer server = new RestApiServer(cfg.server, new PingHandler(ingestor),
                    new HealthCheckHandler(database::isAvailable, scheduler, clock));
            server.start();
            scheduler.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("[------------ Shutdown initiated ------------]");
                server.stop();
                scheduler.shutdown();
                dispatcher.close();
                database.close();
                logger.info("[------------ Croniq shutdown complete ------------]");
            }));

        } catch (Exception e) {
            logger.error("[------------ System startup failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }
    }

    private static ZoneId cronZone(XmlConfiguration cfg) {
        try {
            return ZoneId.of(cfg.monitoring.cronTimeZone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("Invalid monitoring.cronTimeZone '" + cfg.monitoring.cronTimeZone + "'", e);
        }
    }

    static NotificationDispatcher buildDispatcher(XmlConfiguration cfg, NotificationStore store, Clock clock) {
        XmlConfiguration.Notification notification = cfg.notification;
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(Math.max(1, notification.workerThreads), runnable -> {
            Thread thread = new Thread(runnable, "croniq-notify-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        Duration sendTimeout = Duration.ofMillis(notification.sendTimeoutMillis);
        NotificationDispatcher dispatcher = new NotificationDispatcher(store, workers, sendTimeout, clock);

        if (!notification.enabled) {
            logger.warn("Notifications are disabled, alerts will be skipped");
            return dispatcher;
        }

        JsonHttpPoster poster = new JsonHttpPoster(sendTimeout);
        dispatcher.addSender(new SlackSender(poster));
        dispatcher.addSender(new PagerDutySender(poster, notification.pagerDuty != null ? notification.pagerDuty.eventsUrl : null));
        dispatcher.addSender(new WebhookSender(poster));

        XmlConfiguration.Notification.Email email = notification.email;
        if (email != null && email.smtpHost != null && email.fromAddress != null) {
            logger.info("Email config loaded: host={}, port={}, TLS={}, username={}, from={}",
                    email.smtpHost, email.smtpPort, email.useTLS, email.username, email.fromAddress);
            dispatcher.addSender(new EmailSender(email, new TemplateLoader()));
        } else {
            logger.warn("Email configuration is missing or incomplete, email channels will be skipped");
        }
        return dispatcher;
    }
}
