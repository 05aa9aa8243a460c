package io.github.chirino.recall.config;

import io.github.chirino.recall.store.ChatStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Runtime tunables of the memory subsystem.
 *
 * <p>Each value is read through the persisted {@code settings} table first and falls back to the
 * MicroProfile default. Persisted values are parsed leniently and clamped into range; anything
 * unparsable falls back to the default. A missing or broken value is never fatal.
 */
@ApplicationScoped
public class MemorySettings {

    private static final Logger LOG = Logger.getLogger(MemorySettings.class);

    public static final String WINDOW_TOKENS = "window.tokens";
    public static final String IDLE_SECONDS = "summary.idle-seconds";
    public static final String TRIGGER_TOKENS = "summary.trigger-tokens";
    public static final String SIMILARITY_THRESHOLD = "rag.similarity-threshold";
    public static final String PADDING = "rag.padding";
    public static final String TOP_K = "rag.top-k";
    public static final String INDEX_COOLDOWN_SECONDS = "rag.cooldown-seconds";

    @Inject ChatStoreSelector storeSelector;

    @ConfigProperty(name = "chat-recall.window.tokens", defaultValue = "6000")
    int defaultWindowTokens;

    @ConfigProperty(name = "chat-recall.summary.idle-seconds", defaultValue = "10800")
    long defaultIdleSeconds;

    @ConfigProperty(name = "chat-recall.summary.trigger-tokens", defaultValue = "2000")
    int defaultTriggerTokens;

    @ConfigProperty(name = "chat-recall.rag.similarity-threshold", defaultValue = "0.6")
    double defaultSimilarityThreshold;

    @ConfigProperty(name = "chat-recall.rag.padding", defaultValue = "2")
    int defaultPadding;

    @ConfigProperty(name = "chat-recall.rag.top-k", defaultValue = "5")
    int defaultTopK;

    @ConfigProperty(name = "chat-recall.rag.cooldown-seconds", defaultValue = "180")
    long defaultIndexCooldownSeconds;

    /** Token budget of the active window. */
    public int windowTokens() {
        return (int) readLong(WINDOW_TOKENS, defaultWindowTokens, 1, 1_000_000);
    }

    public Duration idleThreshold() {
        return Duration.ofSeconds(readLong(IDLE_SECONDS, defaultIdleSeconds, 1, 30L * 86_400));
    }

    /** Buffer size, in tokens, at which compaction fires regardless of idle time. */
    public int bufferTriggerTokens() {
        return (int) readLong(TRIGGER_TOKENS, defaultTriggerTokens, 1, 1_000_000);
    }

    /** Maximum cosine distance for a vector match. */
    public double similarityThreshold() {
        return readDouble(SIMILARITY_THRESHOLD, defaultSimilarityThreshold, 0.0, 2.0);
    }

    public int neighborhoodPadding() {
        return (int) readLong(PADDING, defaultPadding, 0, 20);
    }

    public int topK() {
        return (int) readLong(TOP_K, defaultTopK, 1, 50);
    }

    public Duration indexCooldown() {
        return Duration.ofSeconds(
                readLong(INDEX_COOLDOWN_SECONDS, defaultIndexCooldownSeconds, 0, 86_400));
    }

    /** Effective value of every tunable, keyed by its settings key. */
    public Map<String, String> effective() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(WINDOW_TOKENS, String.valueOf(windowTokens()));
        values.put(IDLE_SECONDS, String.valueOf(idleThreshold().toSeconds()));
        values.put(TRIGGER_TOKENS, String.valueOf(bufferTriggerTokens()));
        values.put(SIMILARITY_THRESHOLD, String.valueOf(similarityThreshold()));
        values.put(PADDING, String.valueOf(neighborhoodPadding()));
        values.put(TOP_K, String.valueOf(topK()));
        values.put(INDEX_COOLDOWN_SECONDS, String.valueOf(indexCooldown().toSeconds()));
        return values;
    }

    /**
     * Persists an override. Unknown keys are rejected so typos do not silently create dead rows; a
     * null value removes the override.
     */
    public void update(String key, String value) {
        if (!effective().containsKey(key)) {
            throw new IllegalArgumentException("Unknown setting: " + key);
        }
        store().putSetting(key, value == null ? null : value.trim());
        LOG.infof("Setting %s updated to %s", key, value);
    }

    private long readLong(String key, long defaultValue, long min, long max) {
        Optional<String> raw = readRaw(key);
        if (raw.isEmpty()) {
            return clamp(defaultValue, min, max);
        }
        try {
            return clamp(Long.parseLong(raw.get().trim()), min, max);
        } catch (NumberFormatException e) {
            LOG.warnf("Ignoring invalid value '%s' for setting %s", raw.get(), key);
            return clamp(defaultValue, min, max);
        }
    }

    private double readDouble(String key, double defaultValue, double min, double max) {
        Optional<String> raw = readRaw(key);
        if (raw.isEmpty()) {
            return Math.max(min, Math.min(max, defaultValue));
        }
        try {
            double parsed = Double.parseDouble(raw.get().trim());
            if (Double.isNaN(parsed)) {
                throw new NumberFormatException("NaN");
            }
            return Math.max(min, Math.min(max, parsed));
        } catch (NumberFormatException e) {
            LOG.warnf("Ignoring invalid value '%s' for setting %s", raw.get(), key);
            return Math.max(min, Math.min(max, defaultValue));
        }
    }

    private Optional<String> readRaw(String key) {
        try {
            return store().getSetting(key).filter(v -> !v.isBlank());
        } catch (RuntimeException e) {
            LOG.warnf("Could not read setting %s, using default: %s", key, e.getMessage());
            return Optional.empty();
        }
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }

    private ChatStore store() {
        return storeSelector.getStore();
    }
}
