package io.github.chirino.recall.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.List;

/**
 * Micrometer setup for the recall service. Meters exported under Prometheus names:
 *
 * <ul>
 *   <li>chat_recall_store_operation_seconds - message store calls, tagged by operation
 *   <li>chat_recall_summarize_seconds - summarizer latency
 *   <li>chat_recall_archive_passes_total - archive passes, tagged by outcome
 *   <li>chat_recall_index_anchors_total - anchors written to the vector index
 *   <li>chat_recall_embedding_failures_total - failed embedding calls, tagged by model
 * </ul>
 */
@ApplicationScoped
public class MetricsConfig {

    static final String STORE_TIMER = "chat.recall.store.operation";
    static final String SUMMARIZE_TIMER = "chat.recall.summarize";

    @Produces
    @Singleton
    public MeterFilter applicationTagFilter() {
        return MeterFilter.commonTags(List.of(Tag.of("application", "chat-recall")));
    }

    /**
     * Store calls get p95/p99 histograms. Summarizer calls take seconds rather than milliseconds,
     * so they get explicit buckets instead.
     */
    @Produces
    @Singleton
    public MeterFilter latencyDistributionFilter() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(
                    Meter.Id id, DistributionStatisticConfig config) {
                if (STORE_TIMER.equals(id.getName())) {
                    return DistributionStatisticConfig.builder()
                            .percentiles(0.95, 0.99)
                            .percentilesHistogram(true)
                            .build()
                            .merge(config);
                }
                if (SUMMARIZE_TIMER.equals(id.getName())) {
                    return DistributionStatisticConfig.builder()
                            .serviceLevelObjectives(
                                    nanos(Duration.ofSeconds(1)),
                                    nanos(Duration.ofSeconds(5)),
                                    nanos(Duration.ofSeconds(15)),
                                    nanos(Duration.ofSeconds(60)))
                            .build()
                            .merge(config);
                }
                return config;
            }
        };
    }

    private static double nanos(Duration duration) {
        return duration.toNanos();
    }
}
