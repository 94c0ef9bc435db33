package com.example.renderflow_backend.util;

public enum UserTier {
    FREE,
    PRO,
    ENTERPRISE
}
