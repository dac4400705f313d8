package com.yerin.openshow.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobEventType;
import com.yerin.openshow.domain.JobStatus;
import com.yerin.openshow.domain.JobqMetrics;
import com.yerin.openshow.global.exception.AppException;
import com.yerin.openshow.global.exception.JobNotLeasedException;
import com.yerin.openshow.global.exception.code.CommonErrorCode;
import com.yerin.openshow.global.exception.code.JobErrorCode;
import com.yerin.openshow.infra.Backoff;
import com.yerin.openshow.infra.JobIds;
import com.yerin.openshow.infra.JobStore;
import com.yerin.openshow.infra.JsonPayloads;
import com.yerin.openshow.registry.JobPolicy;
import com.yerin.openshow.registry.JobRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pull-model job queue: producers enqueue, workers lease and report back.
 * <p>
 * The store's conditional updates are the only coordination between workers; nothing here
 * locks in-process, so any number of instances may serve these calls concurrently.
 */
@Slf4j
@Service
public class JobQueueService {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 100;
    public static final int MAX_ATTEMPTS_OVERRIDE = 10;
    public static final int MAX_LEASE_LIMIT = 10;

    private final JobStore store;
    private final JobRegistry registry;
    private final Backoff backoff;
    private final JobEventRecorder events;
    private final JobqMetrics metrics;
    private final JsonPayloads json;
    private final Clock clock;
    private final long defaultLeaseSeconds;

    public JobQueueService(JobStore store,
                           JobRegistry registry,
                           Backoff backoff,
                           JobEventRecorder events,
                           JobqMetrics metrics,
                           JsonPayloads json,
                           Clock clock,
                           @Value("${jobq.lease.default-seconds:300}") long defaultLeaseSeconds) {
        // 백오프 상한이 작업별 maxAttempts보다 작으면 두 한도가 어긋난다
        int required = Math.max(registry.maxPolicyAttempts(), MAX_ATTEMPTS_OVERRIDE);
        if (backoff.hardCeiling() < required) {
            throw new IllegalStateException("backoff hard ceiling " + backoff.hardCeiling()
                    + " is below the highest allowed maxAttempts " + required);
        }
        if (defaultLeaseSeconds < 1) {
            throw new IllegalStateException("jobq.lease.default-seconds must be >= 1");
        }
        this.store = store;
        this.registry = registry;
        this.backoff = backoff;
        this.events = events;
        this.metrics = metrics;
        this.json = json;
        this.clock = clock;
        this.defaultLeaseSeconds = defaultLeaseSeconds;
    }

    public Job enqueue(EnqueueCommand cmd) {
        registry.validatePayload(cmd.type(), cmd.payload());
        JobPolicy policy = registry.policyFor(cmd.type());

        int priority = cmd.priority() == null
                ? Job.DEFAULT_PRIORITY
                : requireRange("priority", cmd.priority(), MIN_PRIORITY, MAX_PRIORITY);
        int maxAttempts = cmd.maxAttempts() == null
                ? policy.maxAttempts()
                : requireRange("maxAttempts", cmd.maxAttempts(), 1, MAX_ATTEMPTS_OVERRIDE);

        Instant now = clock.instant();
        Job job = Job.builder()
                .jobId(JobIds.next())
                .type(cmd.type())
                .payloadJson(json.write(cmd.payload()))
                .priority(priority)
                .status(JobStatus.QUEUED)
                .attempt(0)
                .maxAttempts(maxAttempts)
                .nextRunAt(cmd.scheduleAt() != null ? cmd.scheduleAt() : now)
                .createdBy(cmd.createdBy())
                .createdAt(now)
                .updatedAt(now)
                .build();
        job = store.insert(job);

        events.append(job, JobEventType.ENQUEUED, "nextRunAt=" + job.getNextRunAt());
        metrics.incCreated();
        log.info("[JobQueue] enqueued jobId={}, type={}, priority={}, maxAttempts={}, nextRunAt={}",
                job.getJobId(), job.getType(), priority, maxAttempts, job.getNextRunAt());
        return job;
    }

    public Job enqueue(String type, JsonNode payload) {
        return enqueue(EnqueueCommand.of(type, payload));
    }

    /**
     * Claims up to {@code limit} runnable jobs one at a time. An empty list means there is
     * nothing to do right now.
     */
    public List<Job> lease(LeaseCommand cmd) {
        String workerId = requireText("workerId", cmd.workerId());
        int limit = cmd.limit() == null ? 1 : requireRange("limit", cmd.limit(), 1, MAX_LEASE_LIMIT);
        String type = cmd.jobType() == null || cmd.jobType().isBlank() ? null : cmd.jobType();

        JobPolicy policy = type == null ? null : registry.policyFor(type);

        long leaseSeconds;
        if (cmd.leaseDurationSeconds() != null) {
            leaseSeconds = requireRange("leaseDurationSeconds", cmd.leaseDurationSeconds(), 1, Integer.MAX_VALUE);
        } else if (policy != null) {
            leaseSeconds = policy.leaseDurationSeconds();
        } else {
            leaseSeconds = defaultLeaseSeconds;
        }

        Instant now = clock.instant();
        Instant leaseExpiresAt = now.plusSeconds(leaseSeconds);

        List<Job> leased = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Optional<JobStore.Claim> claim = store.claimOne(workerId, type, now, leaseExpiresAt, this::onExhaustedLease);
            if (claim.isEmpty()) {
                break;
            }
            Job job = claim.get().job();
            if (claim.get().reclaimed()) {
                metrics.incReclaimed();
                events.append(job, JobEventType.RECLAIMED, "from=" + claim.get().previousWorkerId());
                log.warn("[JobQueue] reclaimed expired lease jobId={}, from={}, to={}",
                        job.getJobId(), claim.get().previousWorkerId(), workerId);
            }
            events.append(job, JobEventType.LEASED, "leaseExpiresAt=" + leaseExpiresAt);
            metrics.incLeased();
            leased.add(job);
        }

        log.info("[JobQueue] worker {} leased {} jobs (type={}, limit={})", workerId, leased.size(), type, limit);
        return leased;
    }

    public Job reportSuccess(String jobId, String workerId, JsonNode result) {
        Instant now = clock.instant();
        Job job = store.markSucceeded(jobId, workerId, json.write(result), now)
                .orElseThrow(() -> lostLease(jobId, workerId));

        events.append(job, JobEventType.SUCCEEDED, null);
        metrics.incSucceeded();
        log.info("[JobQueue] succeeded jobId={}, workerId={}, attempt={}", jobId, workerId, job.getAttempt());
        return job;
    }

    /**
     * Records a handler failure and either schedules the next attempt or dead-letters the job.
     * The decision is taken on the attempt count read here, and the write only applies if the
     * job is still leased to {@code workerId} with that same attempt.
     */
    public Job reportFailure(String jobId, String workerId, FailureReport error) {
        Job current = store.findLeased(jobId, workerId)
                .orElseThrow(() -> lostLease(jobId, workerId));

        FailureReport report = error == null ? FailureReport.of(null) : error;
        String code = report.codeOrDefault();
        String message = report.messageOrDefault();
        Instant now = clock.instant();
        int attempt = current.getAttempt();

        if (!current.hasAttemptsLeft()) {
            return deadLetter(current, workerId, code, message, now,
                    "attempts exhausted " + attempt + "/" + current.getMaxAttempts());
        }

        Optional<Duration> delay = backoff.delayForAttempt(attempt + 1);
        if (delay.isEmpty()) {
            return deadLetter(current, workerId, code, message, now,
                    "backoff ceiling " + backoff.hardCeiling() + " reached");
        }

        Instant nextRunAt = now.plus(delay.get());
        Job job = store.reschedule(jobId, workerId, attempt, nextRunAt, code, message, now)
                .orElseThrow(() -> lostLease(jobId, workerId));

        events.append(job, JobEventType.RETRY, code + ": " + message);
        metrics.incRetried();
        log.warn("[JobQueue] retry scheduled jobId={}, attempt={}/{}, nextRunAt={}, err={}",
                jobId, attempt, job.getMaxAttempts(), nextRunAt, message);
        return job;
    }

    public Job getJob(String jobId) {
        return store.findByJobId(jobId)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));
    }

    private Job deadLetter(Job current, String workerId, String code, String message, Instant now, String reason) {
        Job job = store.deadLetter(current.getJobId(), workerId, current.getAttempt(), code, message, now)
                .orElseThrow(() -> lostLease(current.getJobId(), workerId));

        events.append(job, JobEventType.DLQ, reason + " - " + code + ": " + message);
        metrics.incDlq();
        log.error("[JobQueue] DLQ jobId={}, type={}, reason={}, err={}",
                job.getJobId(), job.getType(), reason, message);
        return job;
    }

    private void onExhaustedLease(Job job) {
        events.append(job, JobEventType.DLQ, "lease expired on final attempt");
        metrics.incDlq();
        log.error("[JobQueue] DLQ jobId={}, type={}, reason=lease expired on final attempt {}/{}",
                job.getJobId(), job.getType(), job.getAttempt(), job.getMaxAttempts());
    }

    private JobNotLeasedException lostLease(String jobId, String workerId) {
        metrics.incLeaseConflict();
        log.warn("[JobQueue] report rejected, lease not held jobId={}, workerId={}", jobId, workerId);
        return new JobNotLeasedException(jobId, workerId);
    }

    private static int requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new AppException(CommonErrorCode.INVALID_PARAMETER
                    .withDetail(name + "는 " + min + " 이상 " + max + " 이하여야 합니다."));
        }
        return value;
    }

    private static String requireText(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new AppException(CommonErrorCode.INVALID_PARAMETER.withDetail(name + "가 필요합니다."));
        }
        return value;
    }
}
