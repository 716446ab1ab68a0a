package com.phillippitts.voxbank.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Body of {@code POST /api/vox/{scopeId}/synthesize}. Exactly one of {@code text} or
 * {@code composition} is expected.
 */
public record SynthesizeRequest(String text,
                                List<@Valid CompositionEntry> composition,
                                @NotBlank String voiceId,
                                @Valid FilterRequest filter,
                                Integer wordGapMs) {
}
