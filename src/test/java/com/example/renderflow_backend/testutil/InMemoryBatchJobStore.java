package com.example.renderflow_backend.testutil;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.model.BatchJob;
import com.example.renderflow_backend.model.ItemPatch;
import com.example.renderflow_backend.model.JobPatch;
import com.example.renderflow_backend.service.Interfaces.BatchJobStore;
import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.ItemState;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe store keeping detached copies, so callers never share mutable rows. Applies patches with the same
 * rules as the JPA store.
 */
public class InMemoryBatchJobStore implements BatchJobStore {
    private final Map<UUID, BatchJob> jobs = new ConcurrentHashMap<>();
    private final Map<UUID, BatchItem> items = new ConcurrentHashMap<>();

    @Override
    public synchronized UUID insert(BatchJob job, List<BatchItem> newItems) {
        BatchJob stored = job.copy();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID());
        }
        if (stored.getStatus() == null) {
            stored.setStatus(BatchStatus.QUEUED);
        }
        stored.setCreatedAt(Instant.now());
        jobs.put(stored.getId(), stored);
        for (BatchItem item : newItems) {
            item.setBatchId(stored.getId());
            BatchItem copy = item.copy();
            if (copy.getId() == null) {
                copy.setId(UUID.randomUUID());
            }
            item.setId(copy.getId());
            items.put(copy.getId(), copy);
        }
        return stored.getId();
    }

    @Override
    public Optional<BatchJob> findJob(UUID id) {
        return Optional.ofNullable(jobs.get(id)).map(BatchJob::copy);
    }

    @Override
    public List<BatchItem> listItems(UUID batchId) {
        return items.values().stream()
                .filter(i -> batchId.equals(i.getBatchId()))
                .sorted(Comparator.comparingInt(BatchItem::getOrdinal))
                .map(BatchItem::copy)
                .toList();
    }

    @Override
    public Optional<BatchItem> findItem(UUID itemId) {
        return Optional.ofNullable(items.get(itemId)).map(BatchItem::copy);
    }

    @Override
    public Optional<BatchItem> findItemByTaskHandle(String taskHandle) {
        return items.values().stream()
                .filter(i -> taskHandle != null && taskHandle.equals(i.getTaskHandle()))
                .findFirst()
                .map(BatchItem::copy);
    }

    @Override
    public synchronized Optional<BatchJob> mergeJob(UUID id, JobPatch patch) {
        BatchJob job = jobs.get(id);
        if (job == null) {
            return Optional.empty();
        }
        BatchJob working = job.copy();
        if (!patch.applyTo(working, Instant.now())) {
            return Optional.empty();
        }
        working.setVersion(working.getVersion() + 1);
        jobs.put(id, working);
        return Optional.of(working.copy());
    }

    @Override
    public synchronized Optional<BatchItem> mergeItem(UUID itemId, ItemPatch patch) {
        BatchItem item = items.get(itemId);
        if (item == null) {
            return Optional.empty();
        }
        BatchItem working = item.copy();
        if (patch.applyTo(working, Instant.now()) != ItemPatch.Outcome.APPLIED) {
            return Optional.empty();
        }
        working.setVersion(working.getVersion() + 1);
        items.put(itemId, working);
        return Optional.of(working.copy());
    }

    @Override
    public synchronized List<BatchJob> claimQueued(int max) {
        List<BatchJob> claimed = jobs.values().stream()
                .filter(j -> j.getStatus() == BatchStatus.QUEUED)
                .sorted(Comparator.comparing(BatchJob::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(Math.max(0, max))
                .toList();
        List<BatchJob> out = new ArrayList<>();
        for (BatchJob job : claimed) {
            job.setStatus(BatchStatus.RUNNING);
            job.setAttempts(job.getAttempts() + 1);
            if (job.getStartedAt() == null) {
                job.setStartedAt(Instant.now());
            }
            out.add(job.copy());
        }
        return out;
    }

    @Override
    public synchronized int terminateRemaining(UUID batchId, ItemState terminal, PipelineError error) {
        int changed = 0;
        for (BatchItem item : listItems(batchId)) {
            if (mergeItem(item.getId(), ItemPatch.failed(terminal, error)).isPresent()) {
                changed++;
            }
        }
        return changed;
    }

    /** Direct write for test setup. */
    public synchronized void put(BatchJob job) {
        jobs.put(job.getId(), job.copy());
    }
}
