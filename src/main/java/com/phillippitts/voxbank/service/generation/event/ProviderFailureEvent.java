package com.phillippitts.voxbank.service.generation.event;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a synthesis provider call fails (error response, timeout, invalid audio,
 * concurrency limit).
 *
 * <p>PII note: the word being synthesized is user content and is not included; the
 * context carries technical diagnostics only.
 */
public record ProviderFailureEvent(
        String provider,
        String voiceId,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public ProviderFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
