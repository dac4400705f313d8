package com.yerin.openshow.service;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobEventLog;
import com.yerin.openshow.domain.JobEventType;
import com.yerin.openshow.domain.JobStatus;
import com.yerin.openshow.domain.JobqMetrics;
import com.yerin.openshow.global.exception.AppException;
import com.yerin.openshow.infra.JobStore;
import com.yerin.openshow.infra.JsonPayloads;
import com.yerin.openshow.support.MutableClock;
import com.yerin.openshow.support.QueueTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;

import java.time.Duration;
import java.util.Map;

import static com.yerin.openshow.support.Payloads.*;
import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@Import({QueueTestConfig.class, JobStore.class, JobQueueService.class, AdminJobService.class,
        JobEventRecorder.class, JsonPayloads.class, JobqMetrics.class})
@DisplayName("AdminJobService 관리 기능 테스트")
class AdminJobServiceTest {

    @Autowired AdminJobService sut;
    @Autowired JobQueueService queue;
    @Autowired MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(QueueTestConfig.START);
    }

    private Job deadLettered() {
        Job job = queue.enqueue(EnqueueCommand.builder()
                .type("thumbnail.create").payload(thumbnail())
                .priority(70).maxAttempts(1).createdBy("admin_1").build());
        queue.lease(LeaseCommand.of("worker-1"));
        return queue.reportFailure(job.getJobId(), "worker-1", new FailureReport("boom", "fail"));
    }

    private static String code(Throwable e) {
        return ((AppException) e).getErrorCode().getCode();
    }

    @Test
    @DisplayName("DLQ 작업 재실행은 새 작업을 만들고 원본은 DLQ 유지")
    void replay_creates_new_job() {
        Job dead = deadLettered();
        clock.advance(Duration.ofMinutes(5));

        Job copy = sut.replay(dead.getJobId());

        assertThat(copy.getJobId()).isNotEqualTo(dead.getJobId());
        assertThat(copy.getReplayOf()).isEqualTo(dead.getJobId());
        assertThat(copy.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(copy.getAttempt()).isZero();
        assertThat(copy.getMaxAttempts()).isEqualTo(3);
        assertThat(copy.getPriority()).isEqualTo(70);
        assertThat(copy.getCreatedBy()).isEqualTo("admin_1");
        assertThat(copy.getPayloadJson()).isEqualTo(dead.getPayloadJson());
        assertThat(copy.getNextRunAt()).isEqualTo(clock.instant());

        assertThat(queue.getJob(dead.getJobId()).getStatus()).isEqualTo(JobStatus.DLQ);
        assertThat(sut.history(dead.getJobId()))
                .extracting(JobEventLog::getEventType)
                .containsExactly(JobEventType.ENQUEUED, JobEventType.LEASED, JobEventType.DLQ, JobEventType.REPLAYED);
    }

    @Test
    @DisplayName("DLQ가 아닌 작업 재실행은 JOB-002, 없는 작업은 JOB-001")
    void replay_rejects_non_dlq() {
        Job queued = queue.enqueue("thumbnail.create", thumbnail());

        assertThatThrownBy(() -> sut.replay(queued.getJobId()))
                .isInstanceOf(AppException.class)
                .satisfies(e -> assertThat(code(e)).isEqualTo("JOB-002"));
        assertThatThrownBy(() -> sut.replay("job_missing"))
                .isInstanceOf(AppException.class)
                .satisfies(e -> assertThat(code(e)).isEqualTo("JOB-001"));
    }

    @Test
    @DisplayName("상태/타입 필터와 페이지 조회")
    void list_filters_and_pages() {
        for (int i = 0; i < 3; i++) queue.enqueue("thumbnail.create", thumbnail());
        queue.enqueue("payout.execute", payout());
        deadLettered();

        Page<Job> queuedThumbs = sut.list(JobStatus.QUEUED, "thumbnail.create", 0, 2);
        assertThat(queuedThumbs.getTotalElements()).isEqualTo(3);
        assertThat(queuedThumbs.getContent()).hasSize(2);

        Page<Job> all = sut.list(null, null, 0, 100);
        assertThat(all.getTotalElements()).isEqualTo(5);

        Page<Job> dlq = sut.list(JobStatus.DLQ, null, 0, 10);
        assertThat(dlq.getContent()).extracting(Job::getStatus).containsOnly(JobStatus.DLQ);
    }

    @Test
    @DisplayName("상태별 작업 수 집계")
    void stats_counts_each_status() {
        queue.enqueue("thumbnail.create", thumbnail());
        queue.enqueue("payout.execute", payout());
        deadLettered();

        Map<JobStatus, Long> stats = sut.stats();

        assertThat(stats).containsEntry(JobStatus.QUEUED, 2L)
                .containsEntry(JobStatus.DLQ, 1L)
                .containsEntry(JobStatus.LEASED, 0L)
                .containsEntry(JobStatus.SUCCEEDED, 0L);
    }

    @Test
    @DisplayName("없는 작업의 이벤트 조회는 JOB-001")
    void history_of_missing_job() {
        assertThatThrownBy(() -> sut.history("job_missing"))
                .isInstanceOf(AppException.class)
                .satisfies(e -> assertThat(code(e)).isEqualTo("JOB-001"));
    }
}
