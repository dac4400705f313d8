package com.yerin.openshow.infra;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobStatus;
import com.yerin.openshow.domain.JobqMetrics;
import com.yerin.openshow.service.EnqueueCommand;
import com.yerin.openshow.service.JobEventRecorder;
import com.yerin.openshow.service.JobQueueService;
import com.yerin.openshow.service.LeaseCommand;
import com.yerin.openshow.support.MutableClock;
import com.yerin.openshow.support.QueueTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;

import static com.yerin.openshow.support.Payloads.thumbnail;
import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@TestPropertySource(properties = "jobq.reaper.enabled=true")
@Import({QueueTestConfig.class, JobStore.class, JobQueueService.class, JobEventRecorder.class,
        JsonPayloads.class, JobqMetrics.class, LeaseReaper.class})
@DisplayName("만료 리스 회수(LeaseReaper) 테스트")
class LeaseReaperTest {

    @Autowired LeaseReaper reaper;
    @Autowired JobQueueService queue;
    @Autowired MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(QueueTestConfig.START);
    }

    @Test
    @DisplayName("만료 전 리스는 건드리지 않음")
    void leaves_live_leases() {
        queue.enqueue("thumbnail.create", thumbnail());
        queue.lease(LeaseCommand.of("worker-1"));

        clock.advance(Duration.ofSeconds(10));

        assertThat(reaper.reap()).isZero();
    }

    @Test
    @DisplayName("만료된 리스는 QUEUED로, 마지막 시도였다면 DLQ로")
    void requeues_or_dead_letters_expired() {
        Job retryable = queue.enqueue("thumbnail.create", thumbnail());
        Job finalAttempt = queue.enqueue(EnqueueCommand.builder()
                .type("thumbnail.create").payload(thumbnail()).maxAttempts(1).build());
        queue.lease(LeaseCommand.builder().workerId("worker-1").limit(2).build());

        clock.advance(Duration.ofSeconds(301));

        assertThat(reaper.reap()).isEqualTo(2);

        Job requeued = queue.getJob(retryable.getJobId());
        assertThat(requeued.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(requeued.getWorkerId()).isNull();
        assertThat(requeued.getAttempt()).isEqualTo(1);

        Job dead = queue.getJob(finalAttempt.getJobId());
        assertThat(dead.getStatus()).isEqualTo(JobStatus.DLQ);
        assertThat(dead.getLastErrorCode()).isEqualTo("lease_expired");

        assertThat(reaper.reap()).isZero();
    }
}
