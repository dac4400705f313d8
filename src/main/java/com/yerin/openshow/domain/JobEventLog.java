package com.yerin.openshow.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "job_event_log", indexes = @Index(name = "idx_job_event_log_job_id", columnList = "job_id"))
public class JobEventLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 40)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 50)
    private JobEventType eventType;

    @Column(name = "worker_id", length = 200)
    private String workerId;

    @Column(nullable = false)
    private int attempt;

    @Column(columnDefinition = "text")
    private String message;

    @Column(name = "ts", nullable = false)
    private Instant ts;

    @PrePersist void pre() { if (ts == null) ts = Instant.now(); }
}
