package com.bookindexer.ingest.model;

import java.time.Instant;

import org.springframework.data.domain.Persistable;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the scheduled_jobs table, the durable scrape-job queue.
 * The primary key is the deterministic job name, which is what makes enqueueing idempotent.
 */
@Entity
@Table(name = "scheduled_jobs", indexes = @Index(name = "idx_scheduled_jobs_status_created", columnList = "status, created_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob implements Persistable<String> {

    @Id
    @Column(name = "job_name", length = 100, updatable = false, nullable = false)
    private String jobName;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 20, nullable = false)
    private JobKind kind;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    @Column(name = "payload", length = 2000, nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private JobStatus status;

    @Column(name = "attempts", nullable = false)
    private Integer attempts;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "dispatched_at")
    private Instant dispatchedAt;

    // Job names are assigned, so Spring Data cannot infer newness from a null id
    @Transient
    @Builder.Default
    private boolean isNew = true;

    @Override
    public String getId() {
        return jobName;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (status == null) {
            status = JobStatus.PENDING;
        }
        if (attempts == null) {
            attempts = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    @PostPersist
    @PostLoad
    protected void markNotNew() {
        isNew = false;
    }

    public enum JobStatus {
        PENDING, DISPATCHED, FAILED
    }
}
