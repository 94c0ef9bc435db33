package com.example.renderflow_backend.service;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.model.BatchJob;
import com.example.renderflow_backend.model.ItemPatch;
import com.example.renderflow_backend.model.JobPatch;
import com.example.renderflow_backend.repository.BatchItemRepository;
import com.example.renderflow_backend.repository.BatchJobRepository;
import com.example.renderflow_backend.service.Interfaces.BatchJobStore;
import com.example.renderflow_backend.util.ItemState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

@Service
public class JpaBatchJobStore implements BatchJobStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaBatchJobStore.class);
    static final int MAX_MERGE_ATTEMPTS = 5;
    private static final EnumSet<ItemState> TERMINAL = EnumSet.of(ItemState.READY, ItemState.FAILED, ItemState.TIMED_OUT);

    private final BatchJobRepository jobRepo;
    private final BatchItemRepository itemRepo;
    private final TransactionTemplate tx;
    private final Clock clock;

    public JpaBatchJobStore(BatchJobRepository jobRepo, BatchItemRepository itemRepo,
                            PlatformTransactionManager transactionManager, Clock clock) {
        this.jobRepo = jobRepo;
        this.itemRepo = itemRepo;
        this.tx = new TransactionTemplate(transactionManager);
        // merges run in their own transaction so a retry re-reads committed state
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    @Override
    public UUID insert(BatchJob job, List<BatchItem> items) {
        return tx.execute(status -> {
            BatchJob saved = jobRepo.save(job);
            items.forEach(item -> item.setBatchId(saved.getId()));
            itemRepo.saveAll(items);
            return saved.getId();
        });
    }

    @Override
    public Optional<BatchJob> findJob(UUID id) {
        return jobRepo.findById(id);
    }

    @Override
    public List<BatchItem> listItems(UUID batchId) {
        return itemRepo.findByBatchIdOrderByOrdinalAsc(batchId);
    }

    @Override
    public Optional<BatchItem> findItem(UUID itemId) {
        return itemRepo.findById(itemId);
    }

    @Override
    public Optional<BatchItem> findItemByTaskHandle(String taskHandle) {
        if (taskHandle == null || taskHandle.isBlank()) {
            return Optional.empty();
        }
        return itemRepo.findFirstByTaskHandle(taskHandle);
    }

    @Override
    public Optional<BatchJob> mergeJob(UUID id, JobPatch patch) {
        return withVersionRetry("job " + id, () -> tx.execute(status -> {
            BatchJob job = jobRepo.findById(id).orElse(null);
            if (job == null || !patch.applyTo(job, clock.instant())) {
                return Optional.<BatchJob>empty();
            }
            return Optional.of(jobRepo.saveAndFlush(job));
        }));
    }

    @Override
    public Optional<BatchItem> mergeItem(UUID itemId, ItemPatch patch) {
        return withVersionRetry("item " + itemId, () -> tx.execute(status -> {
            BatchItem item = itemRepo.findById(itemId).orElse(null);
            if (item == null) {
                return Optional.<BatchItem>empty();
            }
            ItemPatch.Outcome outcome = patch.applyTo(item, clock.instant());
            if (outcome != ItemPatch.Outcome.APPLIED) {
                if (outcome == ItemPatch.Outcome.ILLEGAL_TRANSITION) {
                    LOGGER.warn("Refused item transition itemId={} from={} to={}", itemId, item.getState(), patch.state());
                }
                return Optional.<BatchItem>empty();
            }
            return Optional.of(itemRepo.saveAndFlush(item));
        }));
    }

    @Override
    public List<BatchJob> claimQueued(int max) {
        if (max <= 0) {
            return List.of();
        }
        return tx.execute(status -> {
            List<UUID> ids = jobRepo.selectQueuedIdsForUpdate(max);
            if (ids.isEmpty()) {
                return List.<BatchJob>of();
            }
            if (jobRepo.markRunningBatch(ids) <= 0) {
                return List.<BatchJob>of();
            }
            Map<UUID, Integer> order = new HashMap<>();
            for (int i = 0; i < ids.size(); i++) {
                order.put(ids.get(i), i);
            }
            List<BatchJob> jobs = new ArrayList<>(jobRepo.findAllById(ids));
            jobs.sort(Comparator.comparingInt(j -> order.getOrDefault(j.getId(), Integer.MAX_VALUE)));
            return jobs;
        });
    }

    @Override
    public int terminateRemaining(UUID batchId, ItemState terminal, PipelineError error) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        int changed = 0;
        for (BatchItem item : itemRepo.findByBatchIdAndStateNotIn(batchId, TERMINAL)) {
            if (mergeItem(item.getId(), ItemPatch.failed(terminal, error)).isPresent()) {
                changed++;
            }
        }
        return changed;
    }

    private <T> T withVersionRetry(String what, Supplier<T> write) {
        OptimisticLockingFailureException last = null;
        for (int attempt = 1; attempt <= MAX_MERGE_ATTEMPTS; attempt++) {
            try {
                return write.get();
            } catch (OptimisticLockingFailureException e) {
                last = e;
                LOGGER.debug("Version conflict on {} attempt={}", what, attempt);
            }
        }
        throw last;
    }
}
