package org.croniq.config;

import jakarta.xml.bind.annotation.XmlRootElement;

/**
 * Typed view of {@code config.xml}. Fields left out of the file keep the defaults below.
 */
@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server = new Server();
    public DataSource dataSource;
    public ConnectionPool connectionPool = new ConnectionPool();
    public Monitoring monitoring = new Monitoring();
    public Notification notification = new Notification();

    // --- Undertow Server ---
    @XmlRootElement(name = "server")
    public static class Server {
        public String host = "0.0.0.0";
        public int port = 8080;
        public int ioThreads = 2;
        public int workerThreads = 16;
        public String basePath = "/api/v1";
    }

    // --- Data Source ---
    @XmlRootElement(name = "dataSource")
    public static class DataSource {
        public String driverClassName;
        public String jdbcUrl;
        public String username;
        public String password;
        public boolean encrypt;
        public boolean initializeSchema;
    }

    // --- HikariCP Connection Pool ---
    @XmlRootElement(name = "connectionPool")
    public static class ConnectionPool {
        public int maximumPoolSize = 10;
        public int minimumIdle = 2;
        public long idleTimeout = 600_000;
        public long connectionTimeout = 30_000;
        public long maxLifetime = 1_800_000;
    }

    // --- Heartbeat monitoring ---
    @XmlRootElement(name = "monitoring")
    public static class Monitoring {
        public long scanIntervalSeconds = 60;
        public double escalationMultiplier = 3.0;
        public String cronTimeZone = "UTC";
        public int pingRetryAttempts = 3;
    }

    @XmlRootElement(name = "notification")
    public static class Notification {
        public boolean enabled = true;
        public int workerThreads = 4;
        public long sendTimeoutMillis = 10_000;
        public Email email;
        public PagerDuty pagerDuty = new PagerDuty();

        @XmlRootElement(name = "email")
        public static class Email {
            public String smtpHost;
            public int smtpPort = 587;
            public boolean useTLS = true;
            public String username;
            public String password;
            public String fromName = "Croniq Alerts";
            public String fromAddress;
            public int connectionTimeout = 10_000;
        }

        @XmlRootElement(name = "pagerDuty")
        public static class PagerDuty {
            public String eventsUrl = "https://events.pagerduty.com/v2/enqueue";
        }
    }
}
