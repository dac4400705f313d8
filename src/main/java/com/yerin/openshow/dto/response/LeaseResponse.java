package com.yerin.openshow.dto.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.openshow.domain.Job;
import com.yerin.openshow.infra.JsonPayloads;

import java.time.Instant;
import java.util.List;

public record LeaseResponse(Instant leasedAt, List<LeasedJob> jobs) {

    public record LeasedJob(String jobId, String type, JsonNode payload, int attempt, Instant leaseExpiresAt) {
        public static LeasedJob from(Job j, JsonPayloads json) {
            return new LeasedJob(j.getJobId(), j.getType(), json.read(j.getPayloadJson()),
                    j.getAttempt(), j.getLeaseExpiresAt());
        }
    }

    public static LeaseResponse of(Instant leasedAt, List<Job> jobs, JsonPayloads json) {
        return new LeaseResponse(leasedAt, jobs.stream().map(j -> LeasedJob.from(j, json)).toList());
    }
}
