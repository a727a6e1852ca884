package com.example.prsync.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * One unit of work inside a poll pass: a tracked repository or a single watched pull request.
 * Tracks status, counts and the failure reason for diagnosis.
 */
@Entity
@Table(name = "sync_jobs", indexes = {
        @Index(name = "idx_sync_jobs_target_status", columnList = "target,status"),
        @Index(name = "idx_sync_jobs_created_at", columnList = "created_at")
})
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 50)
    private JobType jobType;

    /** owner/name or owner/name#number */
    @Column(name = "target", nullable = false)
    private String target;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "records_fetched")
    private Integer recordsFetched;

    @Column(name = "records_saved")
    private Integer recordsSaved;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public Long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return java.time.Duration.between(startedAt, completedAt).toMillis();
    }

    public void markAsStarted(String correlationId, LocalDateTime now) {
        this.status = JobStatus.RUNNING;
        this.startedAt = now;
        this.correlationId = correlationId;
    }

    public void markAsCompleted(int recordsFetched, int recordsSaved, LocalDateTime now) {
        this.status = JobStatus.COMPLETED;
        this.completedAt = now;
        this.recordsFetched = recordsFetched;
        this.recordsSaved = recordsSaved;
    }

    /**
     * Pull requests were stored, but Jira correlation was unavailable for some of them.
     */
    public void markAsPartialFailure(int recordsFetched, int recordsSaved, String errorMessage, LocalDateTime now) {
        this.status = JobStatus.PARTIAL_FAILURE;
        this.completedAt = now;
        this.recordsFetched = recordsFetched;
        this.recordsSaved = recordsSaved;
        this.errorMessage = errorMessage;
    }

    public void markAsFailed(String errorMessage, LocalDateTime now) {
        this.status = JobStatus.FAILED;
        this.completedAt = now;
        this.errorMessage = errorMessage;
    }

    public enum JobType {
        REPOSITORY_PULL_REQUESTS,
        WATCHED_PULL_REQUEST
    }

    public enum JobStatus {
        RUNNING,
        COMPLETED,
        PARTIAL_FAILURE,
        FAILED
    }
}
