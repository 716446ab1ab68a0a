package com.phillippitts.voxbank.presentation.dto;

import com.phillippitts.voxbank.domain.CustomFilterSettings;
import com.phillippitts.voxbank.domain.FilterPreset;
import com.phillippitts.voxbank.domain.FilterSpec;
import com.phillippitts.voxbank.exception.InvalidRequestException;

import java.util.Locale;

/**
 * Effects selection in a request body: either {@code preset} ("off", "light", "heavy") or
 * all four custom parameters.
 */
public record FilterRequest(String preset,
                            Double highpassHz,
                            Double lowpassHz,
                            Double compressionRatio,
                            Double distortion) {

    /**
     * @throws InvalidRequestException if the preset is unknown or the custom values are
     *         incomplete or out of range
     */
    public FilterSpec toSpec() {
        if (preset != null) {
            try {
                return FilterSpec.preset(FilterPreset.valueOf(preset.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("filter.preset", "Unknown filter preset: " + preset);
            }
        }
        if (highpassHz == null && lowpassHz == null && compressionRatio == null && distortion == null) {
            return FilterSpec.off();
        }
        if (highpassHz == null || lowpassHz == null || compressionRatio == null || distortion == null) {
            throw new InvalidRequestException("filter",
                    "Custom filter requires highpassHz, lowpassHz, compressionRatio and distortion");
        }
        try {
            return FilterSpec.custom(new CustomFilterSettings(highpassHz, lowpassHz, compressionRatio, distortion));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("filter", e.getMessage());
        }
    }

    public static FilterSpec toSpec(FilterRequest request) {
        return request == null ? FilterSpec.off() : request.toSpec();
    }
}
