package com.yerin.openshow.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobStatus;
import com.yerin.openshow.infra.JsonPayloads;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        String jobId,
        String type,
        JsonNode payload,
        int priority,
        JobStatus status,
        int attempt,
        int maxAttempts,
        Instant nextRunAt,
        String workerId,
        Instant leaseExpiresAt,
        JsonNode result,
        LastError lastError,
        String createdBy,
        String replayOf,
        Instant createdAt,
        Instant updatedAt
) {
    public record LastError(String code, String message) {}

    public static JobResponse from(Job j, JsonPayloads json) {
        LastError lastError = j.getLastErrorCode() == null && j.getLastErrorMessage() == null
                ? null
                : new LastError(j.getLastErrorCode(), j.getLastErrorMessage());
        return new JobResponse(
                j.getJobId(),
                j.getType(),
                json.read(j.getPayloadJson()),
                j.getPriority(),
                j.getStatus(),
                j.getAttempt(),
                j.getMaxAttempts(),
                j.getNextRunAt(),
                j.getWorkerId(),
                j.getLeaseExpiresAt(),
                json.read(j.getResultJson()),
                lastError,
                j.getCreatedBy(),
                j.getReplayOf(),
                j.getCreatedAt(),
                j.getUpdatedAt()
        );
    }
}
