package org.croniq.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;

/**
 * Environment bootstrap: resolves settings from the process environment, falling back to
 * a {@code .env} file, and picks the Logback configuration for the active environment.
 */
public class KeyProvider {

    private static final Logger logger = LoggerFactory.getLogger(KeyProvider.class);

    public static final String ENV_ENVIRONMENT = "APP_ENV";
    public static final String ENV_DB_PASSWORD = "CRONIQ_DB_PASSWORD";
    public static final String ENV_SMTP_PASSWORD = "CRONIQ_SMTP_PASSWORD";

    private static volatile Dotenv dotenv;
    private static volatile boolean loggingInitialized = false;
    private static volatile String activeEnv;

    private KeyProvider() {}

    /** Switches Logback to {@code logback-dev.xml} or {@code logback.xml}. Idempotent. */
    public static synchronized void initLogging() {
        if (loggingInitialized) return;

        String env = getEnvironment();
        System.setProperty(ENV_ENVIRONMENT, env);
        if (isDev()) {
            loadLogbackFromClasspath("logback-dev.xml");
        } else {
            loadLogbackFromClasspath("logback.xml");
        }
        logger.info("Environment initialized: {}", env);
        loggingInitialized = true;
    }

    /**
     * Looks a variable up in the process environment, then in {@code .env}.
     */
    public static Optional<String> getOptional(String name) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            value = dotenv().get(name);
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    public static String getEnvironment() {
        if (activeEnv == null) {
            activeEnv = getOptional(ENV_ENVIRONMENT).orElse("PRODUCTION").toUpperCase(Locale.ROOT);
        }
        return activeEnv;
    }

    public static boolean isDev() {
        return "DEVELOPMENT".equals(getEnvironment());
    }

    private static Dotenv dotenv() {
        if (dotenv == null) {
            synchronized (KeyProvider.class) {
                if (dotenv == null) {
                    dotenv = Dotenv.configure().ignoreIfMissing().load();
                }
            }
        }
        return dotenv;
    }

    private static void loadLogbackFromClasspath(String resourceName) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream in = KeyProvider.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                logger.warn("Logback config {} not found on classpath, keeping defaults", resourceName);
                return;
            }
            context.reset();
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(in);
        } catch (JoranException | IOException e) {
            System.err.println("Failed to load logback config: " + resourceName + " (" + e.getMessage() + ")");
        }
        StatusPrinter.printInCaseOfErrorsOrWarnings(context);
    }
}
