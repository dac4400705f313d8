package com.yerin.openshow.service;

import lombok.Builder;

@Builder
public record LeaseCommand(
        String workerId,
        String jobType,
        Integer limit,
        Integer leaseDurationSeconds
) {
    public static LeaseCommand of(String workerId) {
        return LeaseCommand.builder().workerId(workerId).build();
    }
}
