package com.example.renderflow_backend.engine;

import com.example.renderflow_backend.config.EngineProperties;
import com.example.renderflow_backend.engine.registry.EngineDefinition;
import com.example.renderflow_backend.engine.registry.RemoteEngine;
import com.example.renderflow_backend.exception.PipelineException;
import com.example.renderflow_backend.util.EngineKind;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Edge functions and paid providers. Providers authenticate with the bearer credential named by the catalog.
 */
@Service
public class RemoteGenerationEngine extends HttpGenerationEngine {
    private final ProviderClients clients;
    private final EngineProperties props;

    public RemoteGenerationEngine(ProviderClients clients, EngineProperties props) {
        super(props.getCallbackUrl());
        this.clients = clients;
        this.props = props;
    }

    @Override
    protected WebClient clientFor(EngineDefinition engine) {
        return clients.get(remote(engine).provider()).webClient();
    }

    @Override
    protected String submitPath(EngineDefinition engine) {
        return engine.kind() == EngineKind.EDGE ? "/generate-video" : "/v1/generations";
    }

    @Override
    protected String pollPath(EngineDefinition engine, String taskHandle) {
        return engine.kind() == EngineKind.EDGE
                ? "/generate-video/status/" + taskHandle
                : "/v1/generations/" + taskHandle;
    }

    @Override
    protected Duration timeoutFor(EngineDefinition engine) {
        return clients.get(remote(engine).provider()).timeout();
    }

    @Override
    protected void addHeaders(EngineDefinition engine, HttpHeaders headers) {
        engine.requiredCredential().ifPresent(key -> {
            String secret = props.getCredentials().get(key);
            if (secret == null || secret.isBlank()) {
                throw PipelineException.configuration("Missing credential " + key + " for engine " + engine.id());
            }
            headers.setBearerAuth(secret);
        });
    }

    private static RemoteEngine remote(EngineDefinition engine) {
        if (engine instanceof RemoteEngine remote) {
            return remote;
        }
        throw new IllegalArgumentException("Not a remote engine: " + engine.id());
    }
}
