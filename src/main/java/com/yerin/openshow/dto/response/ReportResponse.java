package com.yerin.openshow.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportResponse(String jobId, JobStatus status, Integer attempt, Instant nextRunAt) {

    public static ReportResponse succeeded(Job j) {
        return new ReportResponse(j.getJobId(), j.getStatus(), null, null);
    }

    public static ReportResponse failed(Job j) {
        return new ReportResponse(j.getJobId(), j.getStatus(), j.getAttempt(), j.getNextRunAt());
    }
}
