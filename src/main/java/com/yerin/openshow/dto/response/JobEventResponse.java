package com.yerin.openshow.dto.response;

import com.yerin.openshow.domain.JobEventLog;
import com.yerin.openshow.domain.JobEventType;

import java.time.Instant;

public record JobEventResponse(JobEventType eventType, String workerId, int attempt, String message, Instant ts) {
    public static JobEventResponse from(JobEventLog e) {
        return new JobEventResponse(e.getEventType(), e.getWorkerId(), e.getAttempt(), e.getMessage(), e.getTs());
    }
}
