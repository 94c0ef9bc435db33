package com.example.renderflow_backend.service.Interfaces;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.model.BatchJob;
import com.example.renderflow_backend.model.ItemPatch;
import com.example.renderflow_backend.model.JobPatch;
import com.example.renderflow_backend.util.ItemState;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Row store for batches and their items. Every mutation is a merge-update by id: the row is re-read, the
 * patch re-applied and the write retried when a concurrent writer bumped the version first.
 */
public interface BatchJobStore {

    /** Persists the batch and all its items atomically; items are bound to the new batch id, which is returned. */
    UUID insert(BatchJob job, List<BatchItem> items);

    Optional<BatchJob> findJob(UUID id);

    /** Items of a batch in creation order. */
    List<BatchItem> listItems(UUID batchId);

    Optional<BatchItem> findItem(UUID itemId);

    Optional<BatchItem> findItemByTaskHandle(String taskHandle);

    /**
     * @return the updated job, empty when the job is unknown or already terminal
     */
    Optional<BatchJob> mergeJob(UUID id, JobPatch patch);

    /**
     * @return the updated item, empty when the item is unknown, terminal, or the transition is illegal
     */
    Optional<BatchItem> mergeItem(UUID itemId, ItemPatch patch);

    /** Moves up to {@code max} queued batches to RUNNING and returns them, oldest first. */
    List<BatchJob> claimQueued(int max);

    /**
     * Forces every non-terminal item of the batch into {@code terminal} with {@code error}.
     *
     * @return number of items changed
     */
    int terminateRemaining(UUID batchId, ItemState terminal, PipelineError error);
}
