package com.example.renderflow_backend.util;

public enum Capability {
    TEXT_TO_VIDEO,
    IMAGE_TO_VIDEO,
    VIDEO_TO_VIDEO,
    AVATAR,
    LIP_SYNC,
    VIDEO_EDIT,
    AUDIO_MIX,
    SUBTITLES
}
