package com.phillippitts.voxbank.service.events;

import com.phillippitts.voxbank.service.generation.event.ProviderFailureEvent;
import com.phillippitts.voxbank.service.metrics.VoxMetrics;
import com.phillippitts.voxbank.service.orchestration.event.SynthesisFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for failure events. Counts every event, logs with a per-key throttle
 * to avoid log spam while a provider is down. Word text never reaches these logs.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final VoxMetrics metrics;
    private final Clock clock;

    ErrorEventsListener(VoxMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @EventListener
    void onProviderFailure(ProviderFailureEvent e) {
        String reason = e.context().getOrDefault("reason", "unknown");
        metrics.incrementProviderFailure(e.provider(), reason);
        if (shouldLog("provider-" + e.provider() + '-' + e.voiceId() + '-' + reason)) {
            LOG.warn("Synthesis provider failing: provider={}, voice={}, reason={}, message={}",
                    e.provider(), e.voiceId(), reason, e.message());
        }
    }

    @EventListener
    void onSynthesisFailed(SynthesisFailedEvent e) {
        if (shouldLog("synthesis-" + e.stage() + '-' + e.reason())) {
            LOG.warn("Synthesis requests failing: stage={}, reason={}, scope={}",
                    e.stage(), e.reason(), e.scopeId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
