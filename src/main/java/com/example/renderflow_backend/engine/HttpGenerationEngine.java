package com.example.renderflow_backend.engine;

import com.example.renderflow_backend.engine.Interfaces.GenerationEngine;
import com.example.renderflow_backend.engine.registry.EngineDefinition;
import com.example.renderflow_backend.exception.PipelineException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared submit/poll plumbing for engines reached over HTTP. Transport failures (connection refused, premature
 * close) are retried a couple of times here; anything else surfaces as ENGINE_ERROR for the item pipeline to
 * handle.
 */
abstract class HttpGenerationEngine implements GenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpGenerationEngine.class);
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);
    private static final int RETRY_MAX_ATTEMPTS = 2;

    private final String callbackUrl;

    protected HttpGenerationEngine(String callbackUrl) {
        this.callbackUrl = callbackUrl;
    }

    protected abstract WebClient clientFor(EngineDefinition engine);

    protected abstract String submitPath(EngineDefinition engine);

    protected abstract String pollPath(EngineDefinition engine, String taskHandle);

    protected abstract Duration timeoutFor(EngineDefinition engine);

    protected void addHeaders(EngineDefinition engine, HttpHeaders headers) {
    }

    protected Map<String, Object> body(Request request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("engine", request.engine().id());
        body.put("batchId", String.valueOf(request.batchId()));
        body.put("itemId", String.valueOf(request.itemId()));
        body.put("prompt", request.prompt());
        body.put("aspect_ratio", request.ratio());
        body.put("duration", request.durationSec());
        if (!request.referenceImageRefs().isEmpty()) body.put("image_urls", request.referenceImageRefs());
        if (!request.sourceVideoRefs().isEmpty()) body.put("video_urls", request.sourceVideoRefs());
        if (!request.options().isEmpty()) body.put("options", request.options());
        if (callbackUrl != null && !callbackUrl.isBlank()) body.put("callback_url", callbackUrl);
        return body;
    }

    @Override
    public Submission submit(Request request) {
        EngineDefinition engine = request.engine();
        WebClient client = clientFor(engine);
        LOGGER.info("ENGINE submit engine={} batch={} item={} ratio={}", engine.id(), request.batchId(),
                request.itemId(), request.ratio());
        JsonNode root = exchange(engine, "submit", client.post()
                .uri(submitPath(engine))
                .headers(h -> addHeaders(engine, h))
                .bodyValue(body(request)));
        return EngineResponses.toSubmission(root, engine.id());
    }

    @Override
    public TaskStatus poll(EngineDefinition engine, String taskHandle) {
        WebClient client = clientFor(engine);
        JsonNode root = exchange(engine, "poll", client.get()
                .uri(pollPath(engine, taskHandle))
                .headers(h -> addHeaders(engine, h)));
        return EngineResponses.toTaskStatus(root, engine.id());
    }

    private JsonNode exchange(EngineDefinition engine, String op, WebClient.RequestHeadersSpec<?> spec) {
        try {
            return spec.retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(body -> PipelineException.engine("Engine %s %s error %s: %s".formatted(
                                            engine.id(), op, resp.statusCode(), truncate(body, 500)), null)))
                    .bodyToMono(JsonNode.class)
                    .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                            .filter(HttpGenerationEngine::isTransient)
                            .doBeforeRetry(signal -> LOGGER.warn("ENGINE {} retry attempt={} engine={} type={}",
                                    op, signal.totalRetriesInARow() + 1, engine.id(),
                                    signal.failure() == null ? "unknown" : signal.failure().getClass().getSimpleName())))
                    .block(timeoutFor(engine));
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof PipelineException pe) {
                throw pe;
            }
            throw PipelineException.engine("Engine %s %s failed: %s".formatted(engine.id(), op, cause.getMessage()), cause);
        }
    }

    static boolean isTransient(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof WebClientRequestException || current instanceof PrematureCloseException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
