package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.RenderBackendProperties;
import com.example.renderflow_backend.service.Interfaces.EnvironmentProbe;
import com.example.renderflow_backend.service.decision.EnvironmentSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically asks the render backend for its health and caches the answer. A failed probe yields an
 * unavailable snapshot; callers always read the cache.
 */
@Service
public class HttpEnvironmentProbe implements EnvironmentProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpEnvironmentProbe.class);

    private final WebClient client;
    private final RenderBackendProperties props;
    private final Clock clock;
    private final AtomicReference<EnvironmentSnapshot> snapshot = new AtomicReference<>(EnvironmentSnapshot.unavailable());

    public HttpEnvironmentProbe(@Qualifier("probeWebClient") WebClient client, RenderBackendProperties props, Clock clock) {
        this.client = client;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public EnvironmentSnapshot current() {
        return snapshot.get();
    }

    @Scheduled(fixedDelayString = "${render-backend.probe-interval-ms:30000}", initialDelay = 0)
    public void refresh() {
        EnvironmentSnapshot previous = snapshot.get();
        EnvironmentSnapshot next = probe();
        snapshot.set(next);
        if (previous.available() != next.available()) {
            LOGGER.info("Render backend availability changed available={} ffmpegReady={} queueDepth={}",
                    next.available(), next.ffmpegReady(), next.queueDepth());
        }
    }

    EnvironmentSnapshot probe() {
        Instant started = clock.instant();
        try {
            JsonNode root = client.get()
                    .uri(props.getHealthPath())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(Math.max(1, props.getProbeTimeoutSeconds())));
            long latency = Duration.between(started, clock.instant()).toMillis();
            return parse(root, latency, clock.instant());
        } catch (RuntimeException e) {
            LOGGER.debug("Render backend probe failed: {}", e.toString());
            return new EnvironmentSnapshot(false, false, 0, 0, null, clock.instant());
        }
    }

    /**
     * Reads the backend's health body. Snake case is the backend's own spelling; camel case and the older
     * {@code status}/{@code ffmpeg} fields are still accepted.
     */
    static EnvironmentSnapshot parse(JsonNode root, long latencyMs, Instant probedAt) {
        if (root == null || !root.isObject()) {
            return new EnvironmentSnapshot(false, false, 0, latencyMs, null, probedAt);
        }
        JsonNode availableNode = field(root, "available");
        boolean available = availableNode.isMissingNode()
                ? !"down".equalsIgnoreCase(root.path("status").asText("ok"))
                : availableNode.asBoolean(false);
        boolean ffmpeg = field(root, "ffmpeg_ready", "ffmpegReady", "ffmpeg").asBoolean(false);
        int queueDepth = field(root, "queue_depth", "queueDepth").asInt(0);
        long latency = field(root, "latency_ms", "latencyMs").asLong(latencyMs);

        JsonNode hw = root.path("hardware");
        List<String> gpus = new ArrayList<>();
        field(hw, "gpu_flags", "gpuFlags", "gpu").forEach(node -> {
            if (!node.asText("").isBlank()) gpus.add(node.asText());
        });
        var hardware = new EnvironmentSnapshot.Hardware(hw.path("cores").asInt(0),
                field(hw, "ram", "ram_mb", "ramMb").asLong(0), gpus);
        return new EnvironmentSnapshot(available, ffmpeg, queueDepth, latency, hardware, probedAt);
    }

    private static JsonNode field(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.path(name);
            if (!value.isMissingNode() && !value.isNull()) {
                return value;
            }
        }
        return MissingNode.getInstance();
    }
}
