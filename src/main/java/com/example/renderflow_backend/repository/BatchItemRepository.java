package com.example.renderflow_backend.repository;

import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.util.ItemState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BatchItemRepository extends JpaRepository<BatchItem, UUID> {
    List<BatchItem> findByBatchIdOrderByOrdinalAsc(UUID batchId);

    List<BatchItem> findByBatchIdAndStateNotIn(UUID batchId, Collection<ItemState> states);

    Optional<BatchItem> findFirstByTaskHandle(String taskHandle);
}
