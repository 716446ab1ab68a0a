package com.phillippitts.voxbank.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/vox/{scopeId}/preview}.
 */
public record PreviewRequest(@NotNull String text, @NotBlank String voiceId, Integer wordGapMs) {
}
