package com.example.renderflow_backend.engine;

import com.example.renderflow_backend.config.EngineProperties;
import com.example.renderflow_backend.engine.Interfaces.GenerationEngine;
import com.example.renderflow_backend.engine.Interfaces.GenerationEngine.Submission;
import com.example.renderflow_backend.engine.Interfaces.GenerationEngine.TaskStatus;
import com.example.renderflow_backend.engine.registry.CapabilityRegistry;
import com.example.renderflow_backend.engine.registry.EngineDefinition;
import com.example.renderflow_backend.exception.PipelineException;
import com.example.renderflow_backend.testutil.StubExchange;
import com.example.renderflow_backend.util.ErrorKind;
import com.example.renderflow_backend.util.Provider;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteGenerationEngineTest {

    private final CapabilityRegistry registry = CapabilityRegistry.withDefaults();

    private RemoteGenerationEngine engine(StubExchange exchange, Provider provider, Map<String, String> credentials) {
        EngineProperties props = new EngineProperties();
        props.setCredentials(credentials);
        props.setCallbackUrl("https://api.example.com/v1/engines/callback");
        ProviderClients clients = new ProviderClients(Map.of(provider,
                new ProviderClients.Client(exchange.client("https://" + provider.key() + ".example.com"),
                        Duration.ofSeconds(5))));
        return new RemoteGenerationEngine(clients, props);
    }

    private GenerationEngine.Request request(EngineDefinition def) {
        return new GenerationEngine.Request(UUID.randomUUID(), UUID.randomUUID(), def, "sunset drone shot", "9:16", 8,
                List.of(), List.of(), Map.of());
    }

    @Test
    void providerSubmitSendsBearerAndReturnsHandle() {
        StubExchange exchange = StubExchange.of(req -> StubExchange.json(HttpStatus.OK,
                "{\"status\":\"queued\",\"taskId\":\"kl-1\"}"));
        EngineDefinition kling = registry.getById("kling_standard").orElseThrow();

        Submission submission = engine(exchange, Provider.KLING, Map.of("KLING_ACCESS_KEY", "secret"))
                .submit(request(kling));

        assertThat(submission).isEqualTo(new Submission.Pending("kl-1"));
        assertThat(exchange.requests()).singleElement().satisfies(r -> {
            assertThat(r.url().getPath()).isEqualTo("/v1/generations");
            assertThat(r.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret");
        });
    }

    @Test
    void missingCredentialIsConfigurationError() {
        StubExchange exchange = StubExchange.of(req -> StubExchange.json(HttpStatus.OK, "{}"));
        EngineDefinition sora = registry.getById("sora").orElseThrow();

        assertThatThrownBy(() -> engine(exchange, Provider.OPENAI, Map.of()).submit(request(sora)))
                .isInstanceOf(PipelineException.class)
                .satisfies(e -> assertThat(((PipelineException) e).getKind()).isEqualTo(ErrorKind.CONFIGURATION_ERROR));
        assertThat(exchange.requests()).isEmpty();
    }

    @Test
    void edgeEnginePollsStatusPath() {
        StubExchange exchange = StubExchange.of(req -> StubExchange.json(HttpStatus.OK,
                "{\"status\":\"completed\",\"video_url\":\"https://cdn/edge.mp4\"}"));
        EngineDefinition nano = registry.getById("nanobanana").orElseThrow();

        TaskStatus status = engine(exchange, Provider.EDGE, Map.of()).poll(nano, "job-9");

        assertThat(status).isEqualTo(TaskStatus.succeeded("https://cdn/edge.mp4"));
        assertThat(exchange.requests().get(0).url().getPath()).isEqualTo("/generate-video/status/job-9");
        assertThat(exchange.requests().get(0).headers().containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
    }

    @Test
    void serverErrorBecomesEngineError() {
        StubExchange exchange = StubExchange.of(req -> StubExchange.json(HttpStatus.SERVICE_UNAVAILABLE,
                "{\"error\":\"busy\"}"));
        EngineDefinition nano = registry.getById("nanobanana").orElseThrow();

        assertThatThrownBy(() -> engine(exchange, Provider.EDGE, Map.of()).submit(request(nano)))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("503")
                .satisfies(e -> assertThat(((PipelineException) e).getKind()).isEqualTo(ErrorKind.ENGINE_ERROR));
        assertThat(exchange.requests()).hasSize(1);
    }

    @Test
    void prematureCloseIsRetriedAtTransportLevel() {
        AtomicInteger calls = new AtomicInteger();
        StubExchange exchange = StubExchange.of(req -> calls.incrementAndGet() < 2
                ? Mono.error(PrematureCloseException.TEST_EXCEPTION)
                : StubExchange.json(HttpStatus.OK, "{\"url\":\"https://cdn/ok.mp4\"}"));
        EngineDefinition nano = registry.getById("nanobanana").orElseThrow();

        Submission submission = engine(exchange, Provider.EDGE, Map.of()).submit(request(nano));

        assertThat(submission).isEqualTo(new Submission.Completed("https://cdn/ok.mp4"));
        assertThat(calls.get()).isEqualTo(2);
    }
}
