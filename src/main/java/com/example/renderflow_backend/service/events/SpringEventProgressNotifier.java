package com.example.renderflow_backend.service.events;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.service.Interfaces.ProgressNotifier;
import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.ItemState;
import com.example.renderflow_backend.util.PipelineStage;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

@Component
public class SpringEventProgressNotifier implements ProgressNotifier {
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public SpringEventProgressNotifier(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public void stageEntered(UUID batchId, PipelineStage stage) {
        publisher.publishEvent(new BatchStageEvent(batchId, stage, BatchStageEvent.Phase.ENTERED, clock.instant()));
    }

    @Override
    public void stageCompleted(UUID batchId, PipelineStage stage) {
        publisher.publishEvent(new BatchStageEvent(batchId, stage, BatchStageEvent.Phase.COMPLETED, clock.instant()));
    }

    @Override
    public void itemChanged(UUID batchId, UUID itemId, ItemState state, int retryCount, PipelineError error) {
        publisher.publishEvent(new ItemStateEvent(batchId, itemId, state, retryCount, error, clock.instant()));
    }

    @Override
    public void batchFinished(UUID batchId, BatchStatus status, int ready, int total) {
        publisher.publishEvent(new BatchFinishedEvent(batchId, status, ready, total, clock.instant()));
    }
}
