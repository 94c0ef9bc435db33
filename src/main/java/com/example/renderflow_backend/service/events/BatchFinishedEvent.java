package com.example.renderflow_backend.service.events;

import com.example.renderflow_backend.util.BatchStatus;

import java.time.Instant;
import java.util.UUID;

public record BatchFinishedEvent(UUID batchId, BatchStatus status, int ready, int total, Instant at) {
}
