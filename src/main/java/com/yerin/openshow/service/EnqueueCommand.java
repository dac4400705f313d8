package com.yerin.openshow.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

import java.time.Instant;

/**
 * Producer request for a new job. Everything but {@code type} and {@code payload} is optional.
 */
@Builder
public record EnqueueCommand(
        String type,
        JsonNode payload,
        Integer priority,
        Instant scheduleAt,
        Integer maxAttempts,
        String createdBy
) {
    public static EnqueueCommand of(String type, JsonNode payload) {
        return EnqueueCommand.builder().type(type).payload(payload).build();
    }
}
