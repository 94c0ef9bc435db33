package com.example.renderflow_backend.dto.batch;

import com.example.renderflow_backend.util.CostConstraint;
import com.example.renderflow_backend.util.ExecutionMode;
import com.example.renderflow_backend.util.QualityTier;
import com.example.renderflow_backend.util.UserTier;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Batch submission. {@code variationCount × ratios} items are created; ratios default to the configured
 * default ratio.
 */
public record BatchSpecRequest(
        String prompt,
        List<String> sourceRefs,
        List<String> referenceImageRefs,
        List<String> sourceVideoRefs,
        @NotNull @Min(1) Integer variationCount,
        List<String> ratios,
        CostConstraint costConstraint,
        QualityTier qualityPreference,
        ExecutionMode executionMode,
        @Min(1) @Max(600) Integer durationSeconds,
        String market,
        String language,
        String platform,
        UserTier userTier,
        String voiceId
) {
    public List<String> sourceRefsOrEmpty() {
        return sourceRefs == null ? List.of() : sourceRefs;
    }

    public List<String> referenceImageRefsOrEmpty() {
        return referenceImageRefs == null ? List.of() : referenceImageRefs;
    }

    public List<String> sourceVideoRefsOrEmpty() {
        return sourceVideoRefs == null ? List.of() : sourceVideoRefs;
    }

    public boolean hasAnyInput() {
        return (prompt != null && !prompt.isBlank())
                || !sourceRefsOrEmpty().isEmpty()
                || !referenceImageRefsOrEmpty().isEmpty()
                || !sourceVideoRefsOrEmpty().isEmpty();
    }

    public String normalizedVoiceId() {
        return voiceId != null && !voiceId.isBlank() ? voiceId.trim() : null;
    }
}
