package com.yerin.openshow.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.openshow.service.EnqueueCommand;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record EnqueueJobRequest(
        @NotNull(message = "작업 타입은 필수입니다.")
        @Size(min = 3, message = "작업 타입은 3자 이상이어야 합니다.")
        String type,

        @NotNull(message = "작업 페이로드는 필수입니다.")
        JsonNode payload,

        @Min(0) @Max(100)
        Integer priority,

        Instant scheduleAt,

        @Min(1) @Max(10)
        Integer maxAttempts,

        String createdBy
) {
    public EnqueueCommand toCommand() {
        return EnqueueCommand.builder()
                .type(type)
                .payload(payload)
                .priority(priority)
                .scheduleAt(scheduleAt)
                .maxAttempts(maxAttempts)
                .createdBy(createdBy)
                .build();
    }
}
