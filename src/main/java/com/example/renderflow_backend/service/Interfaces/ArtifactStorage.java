package com.example.renderflow_backend.service.Interfaces;

import java.util.UUID;

public interface ArtifactStorage {
    /**
     * Copies a produced artifact into the output bucket.
     *
     * @return public reference of the stored object; internal references are returned unchanged
     */
    String upload(UUID batchId, UUID itemId, String sourceUrl);
}
