package com.yerin.openshow.controller;

import com.yerin.openshow.domain.JobStatus;
import com.yerin.openshow.service.AdminJobService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/admin/metrics")
@RequiredArgsConstructor
public class AdminMetricsController {

    private final AdminJobService adminJobService;

    @GetMapping("/jobs")
    public Map<String, Long> jobCounts(@RequestHeader(value = "X-Admin-Token", required = true)
                                       @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                       String adminToken) {
        Map<String, Long> out = new LinkedHashMap<>();
        adminJobService.stats().forEach((status, count) -> out.put(status.name(), count));
        for (JobStatus status : JobStatus.values()) {
            out.putIfAbsent(status.name(), 0L);
        }
        return out;
    }
}
