package com.yerin.openshow.service;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobEventLog;
import com.yerin.openshow.domain.JobEventType;
import com.yerin.openshow.domain.JobStatus;
import com.yerin.openshow.domain.JobqMetrics;
import com.yerin.openshow.global.exception.AppException;
import com.yerin.openshow.global.exception.code.JobErrorCode;
import com.yerin.openshow.infra.JobIds;
import com.yerin.openshow.infra.JobStore;
import com.yerin.openshow.registry.JobRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminJobService {
    private final JobStore store;
    private final JobRegistry registry;
    private final JobEventRecorder events;
    private final JobqMetrics metrics;
    private final Clock clock;

    /**
     * Re-runs a dead-lettered job as a fresh job with the same type, payload and priority.
     * The DLQ record itself is left untouched.
     */
    @Transactional
    public Job replay(String jobId) {
        Job source = store.findByJobId(jobId)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));

        if (source.getStatus() != JobStatus.DLQ) {
            throw new AppException(JobErrorCode.JOB_NOT_IN_DLQ);
        }

        Instant now = clock.instant();
        Job copy = store.insert(Job.builder()
                .jobId(JobIds.next())
                .type(source.getType())
                .payloadJson(source.getPayloadJson())
                .priority(source.getPriority())
                .status(JobStatus.QUEUED)
                .attempt(0)
                .maxAttempts(registry.policyFor(source.getType()).maxAttempts())
                .nextRunAt(now)
                .createdBy(source.getCreatedBy())
                .replayOf(source.getJobId())
                .createdAt(now)
                .updatedAt(now)
                .build());

        events.append(source, JobEventType.REPLAYED, "replayedAs=" + copy.getJobId());
        events.append(copy, JobEventType.ENQUEUED, "replayOf=" + source.getJobId());
        metrics.incCreated();
        log.info("[AdminJob] replayed DLQ jobId={} as jobId={}", source.getJobId(), copy.getJobId());
        return copy;
    }

    @Transactional(readOnly = true)
    public Page<Job> list(JobStatus status, String type, int page, int perPage) {
        PageRequest pageable = PageRequest.of(page, perPage,
                Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
        return store.search(status, type, pageable);
    }

    @Transactional(readOnly = true)
    public Map<JobStatus, Long> stats() {
        return store.countByStatus();
    }

    @Transactional(readOnly = true)
    public List<JobEventLog> history(String jobId) {
        store.findByJobId(jobId).orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));
        return events.history(jobId);
    }
}
