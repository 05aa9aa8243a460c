package io.github.chirino.recall.config;

import io.smallrye.config.ConfigSourceContext;
import io.smallrye.config.ConfigSourceFactory;
import io.smallrye.config.ConfigValue;
import io.smallrye.config.PropertiesConfigSource;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.eclipse.microprofile.config.spi.ConfigSource;

/**
 * Translates {@code chat-recall.datastore.*} and {@code chat-recall.vector.dimension} into the
 * Quarkus datasource and Liquibase settings they imply.
 *
 * <p>The in-memory store still needs a syntactically valid JDBC URL because Hibernate ORM is on
 * the classpath; the PostgreSQL beans are never resolved in that mode. For PostgreSQL the vector
 * column width of the Liquibase changelog follows the configured index dimension.
 */
public class DatastoreConfigSourceFactory implements ConfigSourceFactory {

    private static final String DATASTORE_TYPE = "chat-recall.datastore.type";
    private static final String MIGRATE_AT_START = "chat-recall.datastore.migrate-at-start";
    private static final String VECTOR_DIMENSION = "chat-recall.vector.dimension";

    // Between application.properties (250) and system properties (300).
    private static final int ORDINAL = 275;

    @Override
    public Iterable<ConfigSource> getConfigSources(ConfigSourceContext context) {
        String type = read(context, DATASTORE_TYPE, "postgres").toLowerCase(Locale.ROOT);
        Map<String, String> properties =
                "memory".equals(type) || "in-memory".equals(type)
                        ? memoryDefaults()
                        : postgresDefaults(context);
        return List.of(new PropertiesConfigSource(properties, "chat-recall-datastore", ORDINAL));
    }

    private static Map<String, String> memoryDefaults() {
        Map<String, String> properties = new HashMap<>();
        properties.put("quarkus.datasource.jdbc.url", "jdbc:postgresql://unused:5432/unused");
        properties.put("quarkus.datasource.jdbc.initial-size", "0");
        properties.put("quarkus.datasource.jdbc.min-size", "0");
        properties.put("quarkus.datasource.jdbc.max-size", "1");
        properties.put("quarkus.datasource.devservices.enabled", "false");
        properties.put("quarkus.liquibase.migrate-at-start", "false");
        return properties;
    }

    private static Map<String, String> postgresDefaults(ConfigSourceContext context) {
        Map<String, String> properties = new HashMap<>();
        properties.put(
                "quarkus.liquibase.migrate-at-start", read(context, MIGRATE_AT_START, "true"));
        properties.put(
                "quarkus.liquibase.change-log-parameters.vectorDimension",
                read(context, VECTOR_DIMENSION, "384"));
        return properties;
    }

    private static String read(ConfigSourceContext context, String key, String defaultValue) {
        ConfigValue value = context.getValue(key);
        if (value == null || value.getValue() == null || value.getValue().isBlank()) {
            return defaultValue;
        }
        return value.getValue().trim();
    }
}
