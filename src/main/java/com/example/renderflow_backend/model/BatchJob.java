package com.example.renderflow_backend.model;

import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.ErrorKind;
import com.example.renderflow_backend.util.PipelineStage;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
        name = "batch_job",
        indexes = {
                @Index(name = "idx_batch_job_status_created", columnList = "status, created_at")
        }
)
public class BatchJob {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private BatchStatus status = BatchStatus.QUEUED;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_stage", length = 32)
    private PipelineStage currentStage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "spec", columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> spec;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "decision", columnDefinition = "jsonb")
    private Map<String, Object> decision;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "completed_stages", columnDefinition = "jsonb", nullable = false)
    private List<String> completedStages = new ArrayList<>();

    // content prepared by the batch-level stages plus the final summary
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "progress", columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> progress = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 32)
    private ErrorKind errorKind;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected BatchJob() {}

    public BatchJob(Map<String, Object> spec, Map<String, Object> decision) {
        this.spec = spec;
        this.decision = decision;
    }

    /** Detached copy, collections included. */
    public BatchJob copy() {
        BatchJob c = new BatchJob(spec == null ? null : new HashMap<>(spec),
                decision == null ? null : new HashMap<>(decision));
        c.id = id;
        c.status = status;
        c.currentStage = currentStage;
        c.completedStages = new ArrayList<>(completedStages);
        c.progress = new HashMap<>(progress);
        c.errorKind = errorKind;
        c.errorMessage = errorMessage;
        c.attempts = attempts;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.startedAt = startedAt;
        c.finishedAt = finishedAt;
        c.version = version;
        return c;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public BatchStatus getStatus() {
        return status;
    }

    public void setStatus(BatchStatus status) {
        this.status = status;
    }

    public PipelineStage getCurrentStage() {
        return currentStage;
    }

    public void setCurrentStage(PipelineStage currentStage) {
        this.currentStage = currentStage;
    }

    public Map<String, Object> getSpec() {
        return spec;
    }

    public void setSpec(Map<String, Object> spec) {
        this.spec = spec;
    }

    public Map<String, Object> getDecision() {
        return decision;
    }

    public void setDecision(Map<String, Object> decision) {
        this.decision = decision;
    }

    public List<String> getCompletedStages() {
        return completedStages;
    }

    public void setCompletedStages(List<String> completedStages) {
        this.completedStages = completedStages;
    }

    public Map<String, Object> getProgress() {
        return progress;
    }

    public void setProgress(Map<String, Object> progress) {
        this.progress = progress;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(ErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = BatchStatus.QUEUED;
    }
}
