package com.example.renderflow_backend.util;

/**
 * Remote engine families. The key is the provider segment used under {@code engines.providers}.
 */
public enum Provider {
    EDGE("edge"),
    FAL("fal"),
    KLING("kling"),
    RUNWAY("runway"),
    OPENAI("openai"),
    GOOGLE("google"),
    MINIMAX("minimax"),
    PIKA("pika"),
    LUMA("luma"),
    HEYGEN("heygen");

    private final String key;

    Provider(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
