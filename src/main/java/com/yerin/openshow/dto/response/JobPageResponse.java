package com.yerin.openshow.dto.response;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.infra.JsonPayloads;
import org.springframework.data.domain.Page;

import java.util.List;

public record JobPageResponse(List<JobResponse> items, int page, int perPage, long total, int totalPages) {
    public static JobPageResponse from(Page<Job> page, JsonPayloads json) {
        return new JobPageResponse(
                page.getContent().stream().map(j -> JobResponse.from(j, json)).toList(),
                page.getNumber() + 1,
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages());
    }
}
