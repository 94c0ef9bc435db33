package com.example.renderflow_backend.dto.batch;

import com.example.renderflow_backend.util.BatchStatus;

import java.util.UUID;

public record BatchSubmitResponse(UUID jobId, BatchStatus status, String engineId, int itemCount) {
}
