package com.example.renderflow_backend.repository;

import com.example.renderflow_backend.model.BatchJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface BatchJobRepository extends JpaRepository<BatchJob, UUID> {

    @Query(value = """
        SELECT id FROM batch_job
        WHERE status = 'QUEUED'
        ORDER BY created_at
        FOR UPDATE SKIP LOCKED
        LIMIT :limit
        """, nativeQuery = true)
    List<UUID> selectQueuedIdsForUpdate(@Param("limit") int limit);

    @Modifying(clearAutomatically = true)
    @Query(value = """
        UPDATE batch_job
           SET status = 'RUNNING',
               updated_at = now(),
               started_at = COALESCE(started_at, now()),
               attempts = COALESCE(attempts,0) + 1,
               version = version + 1
         WHERE id IN (:ids)
           AND status = 'QUEUED'
        """, nativeQuery = true)
    int markRunningBatch(@Param("ids") Collection<UUID> ids);
}
