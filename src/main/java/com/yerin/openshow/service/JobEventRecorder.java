package com.yerin.openshow.service;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobEventLog;
import com.yerin.openshow.domain.JobEventType;
import com.yerin.openshow.repository.JobEventLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Append-only transition history. A failed write is logged and dropped; it never undoes a
 * transition the store already committed. Inside a caller's transaction (replay) the failed
 * save still marks that transaction rollback-only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobEventRecorder {

    private final JobEventLogRepository logRepository;
    private final Clock clock;

    public void append(Job job, JobEventType event, String message) {
        try {
            logRepository.save(JobEventLog.builder()
                    .jobId(job.getJobId())
                    .eventType(event)
                    .workerId(job.getWorkerId())
                    .attempt(job.getAttempt())
                    .message(message)
                    .ts(clock.instant())
                    .build());
        } catch (DataAccessException e) {
            log.error("[JobEvent] failed to record jobId={}, event={}, attempt={}",
                    job.getJobId(), event, job.getAttempt(), e);
        }
    }

    public List<JobEventLog> history(String jobId) {
        return logRepository.findByJobIdOrderByIdAsc(jobId);
    }
}
