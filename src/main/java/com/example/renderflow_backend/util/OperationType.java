package com.example.renderflow_backend.util;

import java.util.EnumSet;
import java.util.Set;

/**
 * Operation a decision is made for. Editing operations can run on the local ffmpeg backend; the
 * generation operations need a model-backed engine.
 */
public enum OperationType {
    TRIM,
    CONCAT,
    OVERLAY,
    RESIZE,
    AUDIO_MIX,
    FILTER,
    SUBTITLE_BURN,
    SPEED,
    FADE,
    VIDEO_RENDER,
    VIDEO_TRANSFORM,
    VIDEO_GENERATION,
    AVATAR_GENERATION;

    private static final Set<OperationType> NATIVE = EnumSet.of(
            TRIM, CONCAT, OVERLAY, RESIZE, AUDIO_MIX, FILTER, SUBTITLE_BURN, SPEED, FADE,
            VIDEO_RENDER, VIDEO_TRANSFORM);

    /** Operations the local ffmpeg backend executes natively. */
    public boolean isNativelyHandled() {
        return NATIVE.contains(this);
    }

    /** Capability an engine needs for a native operation; {@code null} for generation. */
    public Capability editCapability() {
        return switch (this) {
            case AUDIO_MIX -> Capability.AUDIO_MIX;
            case SUBTITLE_BURN -> Capability.SUBTITLES;
            case VIDEO_GENERATION, AVATAR_GENERATION -> null;
            default -> Capability.VIDEO_EDIT;
        };
    }
}
