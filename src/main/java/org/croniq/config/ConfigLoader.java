package org.croniq.config;

import org.croniq.config.utils.XmlUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;

public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * Loads {@code path} from the file system, or from the classpath when no such file exists,
     * and applies the password overrides from the environment.
     */
    public static XmlConfiguration loadConfig(String path) {
        return loadConfig(path, KeyProvider::getOptional);
    }

    static XmlConfiguration loadConfig(String path, Function<String, Optional<String>> env) {
        try (InputStream in = open(path)) {
            Document doc = XmlUtil.parse(in);
            XmlConfiguration cfg = XmlUtil.unmarshal(doc, XmlConfiguration.class);
            applyOverrides(cfg, env);
            return cfg;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file " + path + ": " + e.getMessage(), e);
        }
    }

    private static InputStream open(String path) throws IOException {
        Path file = Path.of(path);
        if (Files.isRegularFile(file)) {
            logger.debug("Reading configuration from file {}", file.toAbsolutePath());
            return Files.newInputStream(file);
        }
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(path);
        if (in == null) {
            throw new IllegalStateException("Config file " + path + " not found on disk or classpath");
        }
        logger.debug("Reading configuration from classpath resource {}", path);
        return in;
    }

    private static void applyOverrides(XmlConfiguration cfg, Function<String, Optional<String>> env) {
        if (cfg.dataSource != null) {
            env.apply(KeyProvider.ENV_DB_PASSWORD).ifPresent(password -> {
                cfg.dataSource.password = password;
                logger.info("Database password taken from {}", KeyProvider.ENV_DB_PASSWORD);
            });
        }
        if (cfg.notification != null && cfg.notification.email != null) {
            env.apply(KeyProvider.ENV_SMTP_PASSWORD).ifPresent(password -> {
                cfg.notification.email.password = password;
                logger.info("SMTP password taken from {}", KeyProvider.ENV_SMTP_PASSWORD);
            });
        }
    }
}
