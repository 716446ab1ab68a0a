package com.phillippitts.voxbank.domain;

import java.util.Optional;

/**
 * Named effects presets. {@link #OFF} passes audio through untouched.
 */
public enum FilterPreset {
    OFF(null),
    LIGHT(new CustomFilterSettings(300.0, 3_400.0, 2.0, 0.1)),
    HEAVY(new CustomFilterSettings(500.0, 2_500.0, 4.0, 0.35));

    private final CustomFilterSettings settings;

    FilterPreset(CustomFilterSettings settings) {
        this.settings = settings;
    }

    /**
     * Returns the chain parameters, or empty for {@link #OFF}.
     */
    public Optional<CustomFilterSettings> settings() {
        return Optional.ofNullable(settings);
    }
}
