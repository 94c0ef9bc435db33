package com.example.renderflow_backend.service.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class ProgressLoggingListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressLoggingListener.class);

    @EventListener
    public void onStage(BatchStageEvent event) {
        LOGGER.info("BATCH stage={} phase={} batch={}", event.stage().label(), event.phase(), event.batchId());
    }

    @EventListener
    public void onItem(ItemStateEvent event) {
        if (event.error() != null) {
            LOGGER.warn("ITEM state={} batch={} item={} retries={} errorKind={} error={}", event.state(),
                    event.batchId(), event.itemId(), event.retryCount(), event.error().kind(), event.error().message());
        } else {
            LOGGER.info("ITEM state={} batch={} item={} retries={}", event.state(), event.batchId(), event.itemId(),
                    event.retryCount());
        }
    }

    @EventListener
    public void onFinished(BatchFinishedEvent event) {
        LOGGER.info("BATCH {} batch={} ready={}/{}", event.status(), event.batchId(), event.ready(), event.total());
    }
}
