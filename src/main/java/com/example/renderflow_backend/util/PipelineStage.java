package com.example.renderflow_backend.util;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed stage order of a batch. Stages flagged {@code perItem} share one window in which every item
 * advances on its own; the others run once for the whole batch.
 */
public enum PipelineStage {
    DECONSTRUCT("deconstruct", false),
    REWRITE("rewrite", false),
    VOICE_PREP("voice-prep", false),
    VIDEO_DISPATCH("video-dispatch", true),
    ENCODE("encode", true),
    MUSIC_SYNC("music-sync", true),
    SUBTITLE_BURN("subtitle-burn", true),
    EXPORT("export", true),
    UPLOAD("upload", true),
    URL_VALIDATE("url-validate", true),
    COMPLETE("complete", false);

    private final String label;
    private final boolean perItem;

    PipelineStage(String label, boolean perItem) {
        this.label = label;
        this.perItem = perItem;
    }

    public String label() {
        return label;
    }

    public boolean isPerItem() {
        return perItem;
    }

    public static List<PipelineStage> batchLevelPrefix() {
        return List.of(DECONSTRUCT, REWRITE, VOICE_PREP);
    }

    public static List<PipelineStage> itemWindow() {
        return Arrays.stream(values()).filter(PipelineStage::isPerItem).toList();
    }

    /** Post-generation steps applied while an item is ENCODING. */
    public static List<PipelineStage> encodingSteps() {
        return List.of(ENCODE, MUSIC_SYNC, SUBTITLE_BURN, EXPORT);
    }
}
