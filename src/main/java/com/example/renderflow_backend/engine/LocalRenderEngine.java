package com.example.renderflow_backend.engine;

import com.example.renderflow_backend.config.EngineProperties;
import com.example.renderflow_backend.config.RenderBackendProperties;
import com.example.renderflow_backend.engine.registry.EngineDefinition;
import com.example.renderflow_backend.engine.registry.LocalEngine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Runs local engines on the self-hosted ffmpeg render backend.
 */
@Service
public class LocalRenderEngine extends HttpGenerationEngine {
    private final WebClient client;
    private final RenderBackendProperties props;

    public LocalRenderEngine(@Qualifier("renderBackendWebClient") WebClient client, RenderBackendProperties props,
                             EngineProperties engineProperties) {
        super(engineProperties.getCallbackUrl());
        this.client = client;
        this.props = props;
    }

    @Override
    protected WebClient clientFor(EngineDefinition engine) {
        return client;
    }

    @Override
    protected String submitPath(EngineDefinition engine) {
        return "/v1/render";
    }

    @Override
    protected String pollPath(EngineDefinition engine, String taskHandle) {
        return "/v1/tasks/" + taskHandle;
    }

    @Override
    protected Duration timeoutFor(EngineDefinition engine) {
        return Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
    }

    @Override
    protected Map<String, Object> body(Request request) {
        Map<String, Object> body = super.body(request);
        if (request.engine() instanceof LocalEngine local) {
            body.put("gpu", local.hardwareAccelerated());
        }
        return body;
    }
}
