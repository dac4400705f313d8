package com.yerin.openshow.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "job",
        uniqueConstraints = @UniqueConstraint(name = "uk_job_job_id", columnNames = "job_id"),
        indexes = {
                @Index(name = "idx_job_lease_scan", columnList = "status, next_run_at, priority"),
                @Index(name = "idx_job_type", columnList = "type"),
                @Index(name = "idx_job_lease_expires_at", columnList = "lease_expires_at")
        })
@DynamicUpdate
public class Job {

    public static final int DEFAULT_PRIORITY = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 40, updatable = false)
    private String jobId;

    @Column(nullable = false, length = 100, updatable = false)
    private String type;

    @Column(name = "payload_json", nullable = false, columnDefinition = "text")
    private String payloadJson;

    @Column(nullable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private JobStatus status;

    @Column(nullable = false)
    private int attempt;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "next_run_at", nullable = false)
    private Instant nextRunAt;

    @Column(name = "worker_id", length = 200)
    private String workerId;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "result_json", columnDefinition = "text")
    private String resultJson;

    @Column(name = "last_error_code", length = 100)
    private String lastErrorCode;

    @Column(name = "last_error_message", columnDefinition = "text")
    private String lastErrorMessage;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    // DLQ 재실행으로 만들어진 작업이면 원본 jobId
    @Column(name = "replay_of", length = 40)
    private String replayOf;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isLeaseExpired(Instant now) {
        return status == JobStatus.LEASED && leaseExpiresAt != null && !leaseExpiresAt.isAfter(now);
    }

    public boolean hasAttemptsLeft() {
        return attempt < maxAttempts;
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = createdAt;
        if (status == null) status = JobStatus.QUEUED;
        if (nextRunAt == null) nextRunAt = createdAt;
    }

    @PreUpdate
    void preUpdate() { updatedAt = Instant.now(); }
}
