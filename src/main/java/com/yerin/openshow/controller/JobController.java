package com.yerin.openshow.controller;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.dto.request.EnqueueJobRequest;
import com.yerin.openshow.dto.request.ReportFailureRequest;
import com.yerin.openshow.dto.request.ReportSuccessRequest;
import com.yerin.openshow.dto.response.EnqueueJobResponse;
import com.yerin.openshow.dto.response.JobResponse;
import com.yerin.openshow.dto.response.LeaseResponse;
import com.yerin.openshow.dto.response.ReportResponse;
import com.yerin.openshow.global.dto.DataResponse;
import com.yerin.openshow.infra.JsonPayloads;
import com.yerin.openshow.service.JobQueueService;
import com.yerin.openshow.service.LeaseCommand;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    static final String WORKER_HEADER = "X-Worker-Id";

    private final JobQueueService jobQueueService;
    private final JsonPayloads json;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<DataResponse<EnqueueJobResponse>> enqueue(@Valid @RequestBody EnqueueJobRequest request) {
        Job job = jobQueueService.enqueue(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(DataResponse.from(EnqueueJobResponse.from(job)));
    }

    @GetMapping("/lease")
    public ResponseEntity<DataResponse<LeaseResponse>> lease(
            @RequestHeader(WORKER_HEADER)
            @Parameter(description = "워커 식별자", example = "worker-thumbnail-01")
            String workerId,
            @RequestParam(value = "type", required = false) String type,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "leaseDurationSeconds", required = false) Integer leaseDurationSeconds) {
        List<Job> jobs = jobQueueService.lease(LeaseCommand.builder()
                .workerId(workerId)
                .jobType(type)
                .limit(limit)
                .leaseDurationSeconds(leaseDurationSeconds)
                .build());
        return ResponseEntity.ok(DataResponse.from(LeaseResponse.of(clock.instant(), jobs, json)));
    }

    @PostMapping("/{jobId}/succeed")
    public ResponseEntity<DataResponse<ReportResponse>> succeed(
            @PathVariable String jobId,
            @RequestHeader(WORKER_HEADER) String workerId,
            @RequestBody(required = false) ReportSuccessRequest request) {
        Job job = jobQueueService.reportSuccess(jobId, workerId, request == null ? null : request.result());
        return ResponseEntity.ok(DataResponse.from(ReportResponse.succeeded(job)));
    }

    @PostMapping("/{jobId}/fail")
    public ResponseEntity<DataResponse<ReportResponse>> fail(
            @PathVariable String jobId,
            @RequestHeader(WORKER_HEADER) String workerId,
            @RequestBody(required = false) ReportFailureRequest request) {
        Job job = jobQueueService.reportFailure(jobId, workerId,
                request == null ? null : request.toReport());
        return ResponseEntity.ok(DataResponse.from(ReportResponse.failed(job)));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<DataResponse<JobResponse>> get(@PathVariable String jobId) {
        Job job = jobQueueService.getJob(jobId);
        return ResponseEntity.ok(DataResponse.from(JobResponse.from(job, json)));
    }
}
