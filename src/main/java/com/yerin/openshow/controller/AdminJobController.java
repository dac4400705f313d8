package com.yerin.openshow.controller;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobStatus;
import com.yerin.openshow.dto.response.EnqueueJobResponse;
import com.yerin.openshow.dto.response.JobEventResponse;
import com.yerin.openshow.dto.response.JobPageResponse;
import com.yerin.openshow.global.dto.DataResponse;
import com.yerin.openshow.global.exception.AppException;
import com.yerin.openshow.global.exception.code.CommonErrorCode;
import com.yerin.openshow.infra.JsonPayloads;
import com.yerin.openshow.service.AdminJobService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/jobs")
public class AdminJobController {
    private final AdminJobService adminJobService;
    private final JsonPayloads json;

    @GetMapping("/queue")
    public ResponseEntity<DataResponse<JobPageResponse>> queue(
            @RequestHeader(value = "X-Admin-Token", required = true)
            @Parameter(description = "관리자 토큰", example = "test-admin-token")
            String adminToken,
            @RequestParam(value = "status", required = false) JobStatus status,
            @RequestParam(value = "type", required = false) String type,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "per_page", defaultValue = "20") int perPage) {
        if (page < 1 || perPage < 1 || perPage > 100) {
            throw new AppException(CommonErrorCode.INVALID_PARAMETER
                    .withDetail("page는 1 이상, per_page는 1~100 사이여야 합니다."));
        }
        var result = adminJobService.list(status, type, page - 1, perPage);
        return ResponseEntity.ok(DataResponse.from(JobPageResponse.from(result, json)));
    }

    @PostMapping("/{jobId}/replay")
    public ResponseEntity<DataResponse<EnqueueJobResponse>> replay(@PathVariable String jobId,
                                                                   @RequestHeader(value = "X-Admin-Token", required = true)
                                                                   @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                   String adminToken) {
        Job job = adminJobService.replay(jobId);
        return ResponseEntity.ok(DataResponse.from(EnqueueJobResponse.from(job)));
    }

    @GetMapping("/{jobId}/events")
    public ResponseEntity<DataResponse<List<JobEventResponse>>> events(@PathVariable String jobId,
                                                                       @RequestHeader(value = "X-Admin-Token", required = true)
                                                                       @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                       String adminToken) {
        List<JobEventResponse> events = adminJobService.history(jobId).stream()
                .map(JobEventResponse::from)
                .toList();
        return ResponseEntity.ok(DataResponse.from(events));
    }
}
