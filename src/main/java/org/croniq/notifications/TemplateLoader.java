package org.croniq.notifications;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads Mustache templates from {@code templates/} on the classpath and renders them.
 * Compiled templates are cached per name.
 */
public class TemplateLoader {

    private static final Logger logger = LoggerFactory.getLogger(TemplateLoader.class);

    private final MustacheFactory factory = new DefaultMustacheFactory("templates");
    private final Map<String, Mustache> cache = new ConcurrentHashMap<>();

    public String render(String templateName, Map<String, Object> data) {
        Mustache mustache = cache.computeIfAbsent(templateName, name -> {
            logger.debug("[TemplateLoader] Compiling classpath template {}", name);
            return factory.compile(name);
        });
        StringWriter writer = new StringWriter();
        try {
            mustache.execute(writer, data).flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render template " + templateName, e);
        }
        return writer.toString();
    }
}
