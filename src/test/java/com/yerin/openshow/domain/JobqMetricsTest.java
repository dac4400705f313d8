package com.yerin.openshow.domain;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("메트릭 카운터/타이머 집계 테스트")
class JobqMetricsTest {

    @Test
    @DisplayName("카운터 및 타이머 동작 검증")
    void counters_and_timer_work() {
        var reg = new SimpleMeterRegistry();
        var m = new JobqMetrics(reg);

        m.incCreated();
        m.incLeased();
        m.incLeased();
        m.incRetried();
        m.incDlq();
        m.incSucceeded();
        m.incReclaimed();
        m.incLeaseConflict();

        assertThat(reg.find("jobq_jobs_created_total").counter().count()).isEqualTo(1.0);
        assertThat(reg.find("jobq_jobs_leased_total").counter().count()).isEqualTo(2.0);
        assertThat(reg.find("jobq_jobs_retried_total").counter().count()).isEqualTo(1.0);
        assertThat(reg.find("jobq_jobs_dlq_total").counter().count()).isEqualTo(1.0);
        assertThat(reg.find("jobq_jobs_succeeded_total").counter().count()).isEqualTo(1.0);
        assertThat(reg.find("jobq_jobs_reclaimed_total").counter().count()).isEqualTo(1.0);
        assertThat(reg.find("jobq_lease_conflicts_total").counter().count()).isEqualTo(1.0);

        m.handlerTimer("thumbnail.create").record(Duration.ofMillis(5));

        var timer = reg.find("jobq_handler_duration_seconds")
                .tag("type", "thumbnail.create")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.SECONDS)).isGreaterThan(0.0);
    }
}
