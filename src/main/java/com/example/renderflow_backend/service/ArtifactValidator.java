package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Locale;

/**
 * Confirms that a produced artifact URL actually serves a video. Never throws: every failure is a
 * {@code false} outcome.
 */
@Service
public class ArtifactValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactValidator.class);

    private final WebClient client;
    private final PipelineProperties.Validation props;

    public ArtifactValidator(@Qualifier("artifactWebClient") WebClient client, PipelineProperties pipeline) {
        this.client = client;
        this.props = pipeline.getValidation();
    }

    public boolean validate(String url) {
        return validate(url, props.getMaxAttempts(), props.getRetryDelay());
    }

    /**
     * Up to {@code maxAttempts} HEAD requests, waiting {@code retryDelay × attempt} between them.
     */
    public boolean validate(String url, int maxAttempts, Duration retryDelay) {
        if (url == null || url.isBlank()) {
            return false;
        }
        if (isInternal(url)) {
            return true;
        }
        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (headLooksLikeVideo(url, attempt)) {
                return true;
            }
            if (attempt < attempts && !pause(retryDelay.multipliedBy(attempt))) {
                return false;
            }
        }
        LOGGER.warn("Artifact validation failed url={} attempts={}", url, attempts);
        return false;
    }

    /** Non-HTTP object references, which cannot be checked with a HEAD request. */
    public boolean isInternal(String url) {
        if (url.startsWith("storage://")) {
            return true;
        }
        return props.getInternalPrefixes().stream().anyMatch(p -> p != null && !p.isBlank() && url.startsWith(p));
    }

    private boolean headLooksLikeVideo(String url, int attempt) {
        try {
            ResponseEntity<Void> response = client.head()
                    .uri(url)
                    .retrieve()
                    .toBodilessEntity()
                    .block(props.getRequestTimeout());
            if (response == null || !response.getStatusCode().is2xxSuccessful()) {
                return false;
            }
            HttpHeaders headers = response.getHeaders();
            MediaType contentType = headers.getContentType();
            if (!isVideoType(contentType)) {
                LOGGER.debug("Artifact attempt={} url={} rejected contentType={}", attempt, url, contentType);
                return false;
            }
            long length = headers.getContentLength();
            if (length >= 0 && length < props.getMinContentLength()) {
                LOGGER.debug("Artifact attempt={} url={} rejected contentLength={}", attempt, url, length);
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            LOGGER.debug("Artifact attempt={} url={} error={}", attempt, url, e.toString());
            return false;
        }
    }

    private static boolean isVideoType(MediaType type) {
        if (type == null) {
            return false;
        }
        String value = type.toString().toLowerCase(Locale.ROOT);
        return value.startsWith("video/") || value.startsWith("application/octet-stream");
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
