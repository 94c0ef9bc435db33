package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.RenderBackendProperties;
import com.example.renderflow_backend.exception.PipelineException;
import com.example.renderflow_backend.service.Interfaces.EnvironmentProbe;
import com.example.renderflow_backend.util.PipelineStage;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Encode, music sync, subtitle burn and export on the render backend. When the backend is not ready the
 * generated artifact is passed through unchanged.
 */
@Service
public class ItemPostProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ItemPostProcessor.class);

    private final WebClient client;
    private final RenderBackendProperties props;
    private final EnvironmentProbe probe;

    public ItemPostProcessor(@Qualifier("renderBackendWebClient") WebClient client, RenderBackendProperties props,
                             EnvironmentProbe probe) {
        this.client = client;
        this.props = props;
        this.probe = probe;
    }

    /**
     * @return url of the processed artifact
     * @throws PipelineException ENGINE_ERROR when the backend rejects the step
     */
    public String apply(PipelineStage step, UUID itemId, String inputUrl, String ratio, Map<String, Object> options) {
        if (!probe.current().canRunLocally()) {
            LOGGER.debug("POST {} passthrough item={} backend not ready", step.label(), itemId);
            return inputUrl;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("step", step.label());
        body.put("itemId", String.valueOf(itemId));
        body.put("inputUrl", inputUrl);
        body.put("aspect_ratio", ratio);
        if (options != null && !options.isEmpty()) body.put("options", options);
        try {
            JsonNode root = client.post()
                    .uri("/v1/process")
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(err -> PipelineException.engine("Render backend %s error %s: %s"
                                            .formatted(step.label(), resp.statusCode(), err), null)))
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
            String url = root == null ? null : root.path("url").asText(null);
            if (url == null || url.isBlank()) {
                throw PipelineException.engine("Render backend %s returned no url".formatted(step.label()), null);
            }
            return url;
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw PipelineException.engine("Render backend %s failed: %s".formatted(step.label(), e.getMessage()), e);
        }
    }
}
