package com.phillippitts.voxbank.service.metrics;

import com.phillippitts.voxbank.domain.FailureReason;
import com.phillippitts.voxbank.domain.GenerationStatus;
import com.phillippitts.voxbank.domain.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the synthesis pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>End-to-end synthesis latency by outcome (success, failure)</li>
 *   <li>Words served from the word bank, generated, failed and skipped</li>
 *   <li>Provider failures by provider and reason</li>
 *   <li>Failed requests by stage and reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class VoxMetrics {

    private static final String METRIC_PREFIX = "voxbank";

    private final MeterRegistry registry;

    public VoxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "success" or "failure"
     * @param durationNanos end-to-end duration
     */
    public void recordSynthesis(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".synthesis.latency")
                .description("Time taken to synthesize an announcement")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts resolved or unresolved words of a request.
     */
    public void incrementWords(GenerationStatus status, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".words")
                .description("Words per resolution status")
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment(count);
    }

    public void incrementProviderFailure(String provider, String reason) {
        Counter.builder(METRIC_PREFIX + ".provider.failure")
                .description("Number of failed provider calls")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementFailedStage(PipelineStage stage, FailureReason reason) {
        Counter.builder(METRIC_PREFIX + ".synthesis.failure")
                .description("Number of failed synthesis requests")
                .tag("stage", stage.name().toLowerCase(Locale.ROOT))
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
