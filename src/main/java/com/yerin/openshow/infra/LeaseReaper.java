package com.yerin.openshow.infra;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobEventType;
import com.yerin.openshow.domain.JobqMetrics;
import com.yerin.openshow.service.JobEventRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Actively returns expired leases to the queue, for job types that may not see lease traffic
 * for a while. Without it, expired leases are only picked up when a later lease call matches them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "jobq.reaper", name = "enabled", havingValue = "true")
public class LeaseReaper {

    private final JobStore store;
    private final JobEventRecorder events;
    private final JobqMetrics metrics;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${jobq.reaper.interval-millis:30000}")
    public int reap() {
        Instant now = clock.instant();

        List<Job> expired = store.findExpiredLeases(now);
        if (expired.isEmpty()) return 0;

        int requeued = 0;
        int deadLettered = 0;
        for (Job j : expired) {
            try {
                if (!j.hasAttemptsLeft()) {
                    if (store.deadLetterExhausted(j, now)) {
                        events.append(j, JobEventType.DLQ, "lease expired on final attempt");
                        metrics.incDlq();
                        deadLettered++;
                    }
                } else if (store.requeueExpired(j, now)) {
                    events.append(j, JobEventType.RECLAIMED, "reaper, from=" + j.getWorkerId());
                    metrics.incReclaimed();
                    requeued++;
                }
            } catch (RuntimeException e) {
                log.warn("[LeaseReaper] failed to revert jobId={}, err={}", j.getJobId(), e.toString());
            }
        }
        log.info("[LeaseReaper] requeued={}, dlq={} (LEASED→QUEUED/DLQ)", requeued, deadLettered);
        return requeued + deadLettered;
    }
}
