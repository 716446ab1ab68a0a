package com.phillippitts.voxbank.service.filter;

import com.phillippitts.voxbank.domain.CustomFilterSettings;
import com.phillippitts.voxbank.domain.FilterSpec;
import com.phillippitts.voxbank.exception.FilterException;
import com.phillippitts.voxbank.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Applies the requested effects to an assembled buffer.
 *
 * <p>{@code Preset(OFF)} returns the input untouched. Any other spec is resolved to
 * {@link CustomFilterSettings} and handed to the {@link AudioEffectsProcessor}. A failure
 * in the processor, or output of the wrong length, fails the whole request: there is no
 * partially filtered or silently unfiltered fallback.
 */
@Component
public class FilterEngine {

    private static final Logger LOG = LogManager.getLogger(FilterEngine.class);

    private final AudioEffectsProcessor processor;

    public FilterEngine(AudioEffectsProcessor processor) {
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
    }

    /**
     * @param pcm assembled PCM buffer
     * @param spec effects selection
     * @return filtered buffer, or {@code pcm} itself when the spec is off
     * @throws FilterException if the effects chain fails
     */
    public byte[] apply(byte[] pcm, FilterSpec spec) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
        Optional<CustomFilterSettings> settings = spec.resolve();
        if (settings.isEmpty()) {
            return pcm;
        }
        long start = System.nanoTime();
        byte[] out;
        try {
            out = processor.process(pcm, settings.get());
        } catch (RuntimeException e) {
            throw new FilterException("Effects chain '" + processor.name() + "' failed for filter "
                    + spec.label() + ": " + e.getMessage(), e);
        }
        if (out == null || out.length != pcm.length) {
            throw new FilterException("Effects chain '" + processor.name() + "' returned "
                    + (out == null ? "no buffer" : out.length + " bytes") + " for " + pcm.length + " bytes input");
        }
        LOG.debug("Applied filter {} to {} bytes in {} ms", spec.label(), pcm.length,
                TimeUtils.elapsedMillis(start));
        return out;
    }
}
