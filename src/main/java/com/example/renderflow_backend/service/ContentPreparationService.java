package com.example.renderflow_backend.service;

import com.example.renderflow_backend.dto.batch.BatchSpecRequest;
import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.util.PipelineStage;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Batch-level preparation: deconstruct the sources into a brief, rewrite one prompt per variation and
 * prepare the voice-over settings. Prompt wording is deterministic for a given spec.
 */
@Service
public class ContentPreparationService {
    static final List<String> ANGLES = List.of(
            "problem-solution hook",
            "testimonial angle",
            "before-after reveal",
            "bold claim opener",
            "question hook",
            "fast listicle pacing");

    public Map<String, Object> run(PipelineStage stage, BatchSpecRequest spec, List<BatchItem> items) {
        return switch (stage) {
            case DECONSTRUCT -> Map.of("brief", deconstruct(spec));
            case REWRITE -> Map.of("prompts", rewrite(spec, items));
            case VOICE_PREP -> Map.of("voice", voice(spec));
            default -> throw new IllegalArgumentException("Not a batch-level stage: " + stage);
        };
    }

    Map<String, Object> deconstruct(BatchSpecRequest spec) {
        Map<String, Object> brief = new LinkedHashMap<>();
        brief.put("basePrompt", basePrompt(spec));
        brief.put("sourceCount", spec.sourceRefsOrEmpty().size());
        brief.put("referenceImageCount", spec.referenceImageRefsOrEmpty().size());
        brief.put("sourceVideoCount", spec.sourceVideoRefsOrEmpty().size());
        if (spec.platform() != null) brief.put("platform", spec.platform());
        if (spec.market() != null) brief.put("market", spec.market());
        if (spec.language() != null) brief.put("language", spec.language());
        return brief;
    }

    /** Prompt per item id. Items rendered in several ratios of the same variation share its angle. */
    Map<String, String> rewrite(BatchSpecRequest spec, List<BatchItem> items) {
        int ratiosPerVariation = spec.ratios() == null || spec.ratios().isEmpty() ? 1 : spec.ratios().size();
        String base = basePrompt(spec);
        Map<String, String> prompts = new LinkedHashMap<>();
        for (BatchItem item : items) {
            int variation = item.getOrdinal() / ratiosPerVariation;
            String angle = ANGLES.get(variation % ANGLES.size());
            StringBuilder prompt = new StringBuilder(base)
                    .append(" | variation ").append(variation + 1)
                    .append(" | ").append(angle)
                    .append(" | ").append(item.getRatio());
            if (spec.platform() != null) prompt.append(" | for ").append(spec.platform());
            if (spec.market() != null) prompt.append(" | market ").append(spec.market());
            prompts.put(String.valueOf(item.getId()), prompt.toString());
        }
        return prompts;
    }

    Map<String, Object> voice(BatchSpecRequest spec) {
        String voiceId = spec.normalizedVoiceId();
        if (voiceId == null) {
            return Map.of("status", "skipped");
        }
        Map<String, Object> voice = new LinkedHashMap<>();
        voice.put("status", "prepared");
        voice.put("voiceId", voiceId);
        voice.put("language", Objects.requireNonNullElse(spec.language(), "en"));
        return voice;
    }

    private static String basePrompt(BatchSpecRequest spec) {
        if (spec.prompt() != null && !spec.prompt().isBlank()) {
            return spec.prompt().trim();
        }
        return "Recreate the reference ad";
    }
}
