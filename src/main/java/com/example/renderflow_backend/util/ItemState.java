package com.example.renderflow_backend.util;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single variation inside a batch.
 * <p>
 * Happy path: QUEUED → GENERATING → ENCODING → UPLOADING → VALIDATING_URL → READY.
 * A failed attempt may move an in-flight item back to GENERATING; terminal states never change.
 */
public enum ItemState {
    QUEUED,
    GENERATING,
    ENCODING,
    UPLOADING,
    VALIDATING_URL,
    READY,
    FAILED,
    TIMED_OUT;

    private static final Set<ItemState> IN_FLIGHT = EnumSet.of(GENERATING, ENCODING, UPLOADING, VALIDATING_URL);

    public boolean isTerminal() {
        return this == READY || this == FAILED || this == TIMED_OUT;
    }

    public boolean canTransitionTo(ItemState target) {
        if (target == null || isTerminal()) {
            return false;
        }
        return switch (target) {
            case QUEUED -> false;
            // retry re-enters generation from any in-flight stage
            case GENERATING -> this == QUEUED || IN_FLIGHT.contains(this);
            case ENCODING -> this == GENERATING;
            case UPLOADING -> this == ENCODING;
            case VALIDATING_URL -> this == UPLOADING;
            case READY -> this == VALIDATING_URL;
            case FAILED, TIMED_OUT -> true;
        };
    }
}
