package com.example.renderflow_backend.service;

import com.example.renderflow_backend.dto.batch.BatchSpecRequest;
import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.util.PipelineStage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentPreparationServiceTest {

    private final ContentPreparationService service = new ContentPreparationService();

    private static BatchSpecRequest spec(String prompt, List<String> ratios, String voiceId) {
        return new BatchSpecRequest(prompt, List.of("storage://ads/ref.mp4"), null, null, 2, ratios, null, null,
                null, 8, "DE", "de", "reels", null, voiceId);
    }

    private static BatchItem item(int ordinal, String ratio) {
        BatchItem item = new BatchItem(UUID.randomUUID(), ordinal, ratio);
        item.setId(UUID.randomUUID());
        return item;
    }

    @Test
    void deconstructSummarisesInputs() {
        Map<String, Object> out = service.run(PipelineStage.DECONSTRUCT, spec("  coffee promo ", null, null), List.of());

        @SuppressWarnings("unchecked")
        Map<String, Object> brief = (Map<String, Object>) out.get("brief");
        assertThat(brief).containsEntry("basePrompt", "coffee promo")
                .containsEntry("sourceCount", 1)
                .containsEntry("platform", "reels")
                .containsEntry("market", "DE");
    }

    @Test
    void promptsFollowVariationAngles() {
        List<BatchItem> items = List.of(item(0, "9:16"), item(1, "1:1"), item(2, "9:16"), item(3, "1:1"));

        @SuppressWarnings("unchecked")
        Map<String, String> prompts = (Map<String, String>) service
                .run(PipelineStage.REWRITE, spec("coffee promo", List.of("9:16", "1:1"), null), items)
                .get("prompts");

        assertThat(prompts).hasSize(4);
        assertThat(prompts.get(items.get(0).getId().toString())).contains("variation 1")
                .contains(ContentPreparationService.ANGLES.get(0)).contains("9:16");
        assertThat(prompts.get(items.get(1).getId().toString())).contains("variation 1").contains("1:1");
        assertThat(prompts.get(items.get(2).getId().toString())).contains("variation 2")
                .contains(ContentPreparationService.ANGLES.get(1));
    }

    @Test
    void missingPromptFallsBackToReferenceRecreation() {
        List<BatchItem> items = List.of(item(0, "9:16"));

        @SuppressWarnings("unchecked")
        Map<String, String> prompts = (Map<String, String>) service
                .run(PipelineStage.REWRITE, spec(null, null, null), items).get("prompts");

        assertThat(prompts.values()).singleElement().asString().startsWith("Recreate the reference ad");
    }

    @Test
    void voiceIsSkippedWithoutVoiceId() {
        assertThat(service.run(PipelineStage.VOICE_PREP, spec("promo", null, " "), List.of()))
                .containsEntry("voice", Map.of("status", "skipped"));

        @SuppressWarnings("unchecked")
        Map<String, Object> voice = (Map<String, Object>) service
                .run(PipelineStage.VOICE_PREP, spec("promo", null, " anna "), List.of()).get("voice");
        assertThat(voice).containsEntry("status", "prepared").containsEntry("voiceId", "anna")
                .containsEntry("language", "de");
    }

    @Test
    void perItemStageIsRejected() {
        assertThatThrownBy(() -> service.run(PipelineStage.ENCODE, spec("promo", null, null), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
