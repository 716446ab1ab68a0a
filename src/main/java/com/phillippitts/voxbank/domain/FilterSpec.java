package com.phillippitts.voxbank.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Effects selection for a request: either a named preset or caller-supplied parameters.
 */
public sealed interface FilterSpec permits FilterSpec.Preset, FilterSpec.Custom {

    /**
     * Resolves the chain parameters. Empty means passthrough.
     */
    Optional<CustomFilterSettings> resolve();

    /**
     * Short label for logs and metric tags.
     */
    String label();

    static FilterSpec off() {
        return new Preset(FilterPreset.OFF);
    }

    static FilterSpec preset(FilterPreset preset) {
        return new Preset(preset);
    }

    static FilterSpec custom(CustomFilterSettings parameters) {
        return new Custom(parameters);
    }

    record Preset(FilterPreset preset) implements FilterSpec {
        public Preset {
            Objects.requireNonNull(preset, "preset must not be null");
        }

        @Override
        public Optional<CustomFilterSettings> resolve() {
            return preset.settings();
        }

        @Override
        public String label() {
            return preset.name().toLowerCase(Locale.ROOT);
        }
    }

    record Custom(CustomFilterSettings parameters) implements FilterSpec {
        public Custom {
            Objects.requireNonNull(parameters, "parameters must not be null");
        }

        @Override
        public Optional<CustomFilterSettings> resolve() {
            return Optional.of(parameters);
        }

        @Override
        public String label() {
            return "custom";
        }
    }
}
