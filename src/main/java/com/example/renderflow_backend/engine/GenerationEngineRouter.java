package com.example.renderflow_backend.engine;

import com.example.renderflow_backend.engine.Interfaces.GenerationEngine;
import com.example.renderflow_backend.engine.registry.EngineDefinition;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class GenerationEngineRouter {
    private final GenerationEngine local;
    private final GenerationEngine remote;

    public GenerationEngineRouter(@Qualifier("localRenderEngine") GenerationEngine local,
                                  @Qualifier("remoteGenerationEngine") GenerationEngine remote) {
        this.local = local;
        this.remote = remote;
    }

    public GenerationEngine forEngine(EngineDefinition engine) {
        return switch (engine.kind()) {
            case LOCAL -> local;
            case EDGE, PROVIDER -> remote;
        };
    }
}
