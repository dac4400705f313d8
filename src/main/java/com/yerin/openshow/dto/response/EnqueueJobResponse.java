package com.yerin.openshow.dto.response;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobStatus;

import java.time.Instant;

public record EnqueueJobResponse(String jobId, JobStatus status, String type, Instant nextRunAt) {
    public static EnqueueJobResponse from(Job j) {
        return new EnqueueJobResponse(j.getJobId(), j.getStatus(), j.getType(), j.getNextRunAt());
    }
}
