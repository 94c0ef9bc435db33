package com.example.renderflow_backend.model;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.util.ErrorKind;
import com.example.renderflow_backend.util.ItemState;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "batch_item",
        uniqueConstraints = @UniqueConstraint(name = "uq_batch_item_ordinal", columnNames = {"batch_id", "ordinal"}),
        indexes = {
                @Index(name = "idx_batch_item_batch", columnList = "batch_id, ordinal"),
                @Index(name = "idx_batch_item_task", columnList = "task_handle")
        }
)
public class BatchItem {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "batch_id", nullable = false, updatable = false)
    private UUID batchId;

    @Column(name = "ordinal", nullable = false, updatable = false)
    private int ordinal;

    @Column(name = "ratio", nullable = false, length = 16)
    private String ratio;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private ItemState state = ItemState.QUEUED;

    @Column(name = "engine_id", length = 64)
    private String engineId;

    @Column(name = "task_handle", length = 255)
    private String taskHandle;

    @Column(name = "artifact_url", columnDefinition = "text")
    private String artifactUrl;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 32)
    private ErrorKind errorKind;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "error_retryable")
    private Boolean errorRetryable;

    @Column(name = "stage_entered_at")
    private Instant stageEnteredAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected BatchItem() {}

    public BatchItem(UUID batchId, int ordinal, String ratio) {
        this.batchId = batchId;
        this.ordinal = ordinal;
        this.ratio = ratio;
    }

    public BatchItem copy() {
        BatchItem c = new BatchItem(batchId, ordinal, ratio);
        c.id = id;
        c.state = state;
        c.engineId = engineId;
        c.taskHandle = taskHandle;
        c.artifactUrl = artifactUrl;
        c.retryCount = retryCount;
        c.errorKind = errorKind;
        c.errorMessage = errorMessage;
        c.errorRetryable = errorRetryable;
        c.stageEnteredAt = stageEnteredAt;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.version = version;
        return c;
    }

    /** Last recorded error, {@code null} when none. */
    public PipelineError lastError() {
        if (errorKind == null) {
            return null;
        }
        return new PipelineError(errorKind, errorMessage, Boolean.TRUE.equals(errorRetryable));
    }

    public void recordError(PipelineError error) {
        if (error == null) {
            this.errorKind = null;
            this.errorMessage = null;
            this.errorRetryable = null;
            return;
        }
        this.errorKind = error.kind();
        this.errorMessage = error.message();
        this.errorRetryable = error.retryable();
    }

    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getBatchId() {
        return batchId;
    }

    public void setBatchId(UUID batchId) {
        this.batchId = batchId;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public String getRatio() {
        return ratio;
    }

    public ItemState getState() {
        return state;
    }

    public void setState(ItemState state) {
        this.state = state;
    }

    public String getEngineId() {
        return engineId;
    }

    public void setEngineId(String engineId) {
        this.engineId = engineId;
    }

    public String getTaskHandle() {
        return taskHandle;
    }

    public void setTaskHandle(String taskHandle) {
        this.taskHandle = taskHandle;
    }

    public String getArtifactUrl() {
        return artifactUrl;
    }

    public void setArtifactUrl(String artifactUrl) {
        this.artifactUrl = artifactUrl;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Boolean getErrorRetryable() {
        return errorRetryable;
    }

    public Instant getStageEnteredAt() {
        return stageEnteredAt;
    }

    public void setStageEnteredAt(Instant stageEnteredAt) {
        this.stageEnteredAt = stageEnteredAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
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
        if (state == null) state = ItemState.QUEUED;
    }
}
