package com.example.renderflow_backend.util;

public enum EngineKind {
    LOCAL,
    EDGE,
    PROVIDER
}
