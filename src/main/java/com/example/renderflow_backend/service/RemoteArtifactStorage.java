package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.StorageProperties;
import com.example.renderflow_backend.exception.PipelineException;
import com.example.renderflow_backend.service.Interfaces.ArtifactStorage;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Imports artifacts into the object store by URL. The store fetches the source itself.
 */
@Service
public class RemoteArtifactStorage implements ArtifactStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteArtifactStorage.class);

    private final WebClient client;
    private final StorageProperties props;

    public RemoteArtifactStorage(@Qualifier("storageWebClient") WebClient client, StorageProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public String upload(UUID batchId, UUID itemId, String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw PipelineException.artifact("No artifact to upload for item " + itemId);
        }
        if (alreadyStored(sourceUrl)) {
            return sourceUrl;
        }
        String key = objectKey(batchId, itemId);
        try {
            JsonNode root = client.post()
                    .uri("/object/import/{bucket}", props.getBucket())
                    .bodyValue(Map.of("key", key, "sourceUrl", sourceUrl))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(body -> PipelineException.engine("Storage import error %s: %s"
                                            .formatted(resp.statusCode(), body), null)))
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
            String url = root == null ? null : root.path("url").asText(null);
            String stored = url == null || url.isBlank() ? props.getPublicPrefix() + key : url;
            LOGGER.info("UPLOAD done item={} key={} url={}", itemId, key, stored);
            return stored;
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw PipelineException.engine("Storage import failed for item " + itemId + ": " + e.getMessage(), e);
        }
    }

    private boolean alreadyStored(String url) {
        if (url.startsWith("storage://")) {
            return true;
        }
        String prefix = props.getPublicPrefix();
        return prefix != null && !prefix.isBlank() && url.startsWith(prefix);
    }

    static String objectKey(UUID batchId, UUID itemId) {
        return "batches/%s/%s.mp4".formatted(batchId, itemId);
    }
}
