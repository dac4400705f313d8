package com.yerin.openshow.support;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestHandlersConfig.class)
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "jobq.worker.enabled=true",
        "jobq.worker.poll-interval-millis=200"
})
@DisplayName("E2E: enqueue → lease → report → DLQ → replay")
class JobQueueFlowIT extends IntegrationTestBase {

    @Autowired
    TestRestTemplate rest;

    private static Map<?, ?> data(ResponseEntity<Map> response) {
        Map<?, ?> body = response.getBody();
        assertThat(body).isNotNull();
        return (Map<?, ?>) body.get("data");
    }

    private HttpEntity<Object> as(String header, String value, Object body) {
        HttpHeaders h = new HttpHeaders();
        h.set(header, value);
        return new HttpEntity<>(body, h);
    }

    private String status(String jobId) {
        return String.valueOf(data(rest.getForEntity("/jobs/{id}", Map.class, jobId)).get("status"));
    }

    @Test
    @DisplayName("인프로세스 워커가 thumbnail.create 작업을 처리해 SUCCEEDED")
    void worker_success_flow() {
        var req = Map.of("type", "thumbnail.create",
                "payload", Map.of("assetId", "asset_123", "versionNumber", 1));
        ResponseEntity<Map> created = rest.postForEntity("/jobs", req, Map.class);

        assertThat(created.getStatusCode().value()).isEqualTo(201);
        String jobId = String.valueOf(data(created).get("jobId"));

        Awaitility.await()
                .atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(300))
                .untilAsserted(() -> assertThat(status(jobId)).isEqualTo("SUCCEEDED"));

        Map<?, ?> job = data(rest.getForEntity("/jobs/{id}", Map.class, jobId));
        assertThat(((Map<?, ?>) job.get("result")).get("thumbnailUrl")).isEqualTo("https://cdn.test/asset_123.png");
    }

    @Test
    @DisplayName("마지막 시도 실패 → DLQ, 관리자 replay는 새 작업 생성")
    void dlq_then_replay() {
        var req = Map.of("type", "thumbnail.create",
                "payload", Map.of("assetId", "asset_bad", "versionNumber", -1),
                "maxAttempts", 1);
        String jobId = String.valueOf(data(rest.postForEntity("/jobs", req, Map.class)).get("jobId"));

        Awaitility.await()
                .atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(300))
                .untilAsserted(() -> assertThat(status(jobId)).isEqualTo("DLQ"));

        ResponseEntity<Map> replay = rest.exchange("/admin/jobs/{id}/replay", HttpMethod.POST,
                as("X-Admin-Token", "test-admin-token", null), Map.class, jobId);

        assertThat(replay.getStatusCode().is2xxSuccessful()).isTrue();
        String newJobId = String.valueOf(data(replay).get("jobId"));
        assertThat(newJobId).isNotEqualTo(jobId);
        assertThat(status(jobId)).isEqualTo("DLQ");
        assertThat(data(rest.getForEntity("/jobs/{id}", Map.class, newJobId)).get("replayOf")).isEqualTo(jobId);
    }

    @Test
    @DisplayName("외부 워커 프로토콜: lease → fail → 재시도 → succeed, 중복 보고는 409")
    void external_worker_protocol() {
        var req = Map.of("type", "payout.execute",
                "payload", Map.of("batchId", "batch_1", "escrowId", "escrow_1"),
                "priority", 90);
        String jobId = String.valueOf(data(rest.postForEntity("/jobs", req, Map.class)).get("jobId"));

        ResponseEntity<Map> lease = rest.exchange("/jobs/lease?type=payout.execute", HttpMethod.GET,
                as("X-Worker-Id", "worker-payout-01", null), Map.class);
        List<?> jobs = (List<?>) data(lease).get("jobs");
        assertThat(jobs).hasSize(1);
        assertThat(((Map<?, ?>) jobs.get(0)).get("jobId")).isEqualTo(jobId);
        assertThat(((Map<?, ?>) jobs.get(0)).get("attempt")).isEqualTo(1);

        ResponseEntity<Map> failed = rest.exchange("/jobs/{id}/fail", HttpMethod.POST,
                as("X-Worker-Id", "worker-payout-01",
                        Map.of("error", Map.of("code", "psp_unavailable", "message", "PSP 503"))),
                Map.class, jobId);
        assertThat(data(failed).get("status")).isEqualTo("QUEUED");
        assertThat(data(failed).get("nextRunAt")).isNotNull();

        Awaitility.await()
                .atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(300))
                .untilAsserted(() -> {
                    ResponseEntity<Map> retry = rest.exchange("/jobs/lease?type=payout.execute", HttpMethod.GET,
                            as("X-Worker-Id", "worker-payout-02", null), Map.class);
                    assertThat((List<?>) data(retry).get("jobs")).hasSize(1);
                });

        ResponseEntity<Map> stale = rest.exchange("/jobs/{id}/succeed", HttpMethod.POST,
                as("X-Worker-Id", "worker-payout-01", Map.of()), Map.class, jobId);
        assertThat(stale.getStatusCode().value()).isEqualTo(409);

        ResponseEntity<Map> ok = rest.exchange("/jobs/{id}/succeed", HttpMethod.POST,
                as("X-Worker-Id", "worker-payout-02", Map.of("result", Map.of("payoutId", "po_1"))),
                Map.class, jobId);
        assertThat(data(ok).get("status")).isEqualTo("SUCCEEDED");

        ResponseEntity<Map> again = rest.exchange("/jobs/{id}/succeed", HttpMethod.POST,
                as("X-Worker-Id", "worker-payout-02", Map.of()), Map.class, jobId);
        assertThat(again.getStatusCode().value()).isEqualTo(409);

        ResponseEntity<Map> events = rest.exchange("/admin/jobs/{id}/events", HttpMethod.GET,
                as("X-Admin-Token", "test-admin-token", null), Map.class, jobId);
        assertThat((List<?>) events.getBody().get("data")).hasSize(5);
    }

    @Test
    @DisplayName("관리자 메트릭: 토큰 없으면 401, 있으면 상태별 집계")
    void admin_metrics() {
        assertThat(rest.getForEntity("/admin/metrics/jobs", String.class).getStatusCode().value()).isEqualTo(401);

        ResponseEntity<String> counts = rest.exchange("/admin/metrics/jobs", HttpMethod.GET,
                as("X-Admin-Token", "test-admin-token", null), String.class);
        assertThat(counts.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(counts.getBody()).contains("QUEUED").contains("LEASED").contains("SUCCEEDED").contains("DLQ");
    }
}
