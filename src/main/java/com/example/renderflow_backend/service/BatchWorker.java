package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.WorkerExecutorProperties;
import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.exception.PipelineException;
import com.example.renderflow_backend.model.BatchJob;
import com.example.renderflow_backend.model.JobPatch;
import com.example.renderflow_backend.service.Interfaces.BatchJobStore;
import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.ErrorKind;
import com.example.renderflow_backend.util.ItemState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Claims queued batches and runs them on the batch executor. A batch that throws is recorded as FAILED on its
 * row, with every unfinished item closed.
 */
@Service
public class BatchWorker {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchWorker.class);

    private final BatchJobStore store;
    private final BatchPipeline pipeline;
    private final Executor batchExecutor;
    private final WorkerExecutorProperties workerProperties;
    private final Semaphore batchSemaphore;

    public BatchWorker(BatchJobStore store, BatchPipeline pipeline,
                       @Qualifier("batchTaskExecutor") Executor batchExecutor,
                       WorkerExecutorProperties workerProperties) {
        this.store = store;
        this.pipeline = pipeline;
        this.batchExecutor = batchExecutor;
        this.workerProperties = workerProperties;
        this.batchSemaphore = new Semaphore(Math.max(1, workerProperties.getMaxConcurrentBatches()));
    }

    @Scheduled(fixedDelayString = "${worker.poll-delay-ms:3000}")
    public void poll() {
        int free = Math.min(workerProperties.getPollBatchSize(), batchSemaphore.availablePermits());
        if (free <= 0) {
            LOGGER.debug("Worker poll tick - all batch slots busy");
            return;
        }
        List<BatchJob> jobs = store.claimQueued(free);
        if (jobs.isEmpty()) {
            LOGGER.debug("Worker poll tick - no batches claimed");
            return;
        }
        LOGGER.info("Worker claimed batches count={} ids={}", jobs.size(), jobs.stream().map(BatchJob::getId).toList());
        jobs.forEach(job -> batchExecutor.execute(() -> runWithSemaphore(job)));
    }

    void runWithSemaphore(BatchJob job) {
        boolean acquired = false;
        long t0 = System.nanoTime();
        try {
            batchSemaphore.acquire();
            acquired = true;
            LOGGER.info("BATCH START batch={} attempts={}", job.getId(), job.getAttempts());
            BatchStatus status = pipeline.run(job);
            LOGGER.info("BATCH {} batch={} in={}ms", status, job.getId(), (System.nanoTime() - t0) / 1_000_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(job, PipelineError.of(ErrorKind.TIMEOUT_ERROR, "Worker interrupted before start"));
        } catch (PipelineException e) {
            LOGGER.error("Batch {} failed kind={}: {}", job.getId(), e.getKind(), e.getMessage(), e);
            recordFailure(job, e.getError());
        } catch (Exception e) {
            LOGGER.error("Batch {} failed: {}", job.getId(), e.toString(), e);
            recordFailure(job, PipelineError.of(ErrorKind.ENGINE_ERROR, String.valueOf(e.getMessage())));
        } finally {
            if (acquired) {
                batchSemaphore.release();
            }
        }
    }

    private void recordFailure(BatchJob job, PipelineError error) {
        ItemState terminal = error.kind() == ErrorKind.TIMEOUT_ERROR ? ItemState.TIMED_OUT : ItemState.FAILED;
        int closed = store.terminateRemaining(job.getId(), terminal, error);
        store.mergeJob(job.getId(), JobPatch.failure(error));
        LOGGER.warn("Batch {} recorded as FAILED kind={} closedItems={}", job.getId(), error.kind(), closed);
    }
}
