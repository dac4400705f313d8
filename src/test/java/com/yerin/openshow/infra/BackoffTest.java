package com.yerin.openshow.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("백오프/지터 계산 테스트")
class BackoffTest {

    Backoff noJitter = new Backoff(Duration.ofMinutes(1), Duration.ofDays(1), 10, 0.1, () -> 0.0);
    Backoff maxJitter = new Backoff(Duration.ofMinutes(1), Duration.ofDays(1), 10, 0.1, () -> 1.0);

    @Test
    @DisplayName("지터 0이면 base * 2^(n-1)")
    void exponential_without_jitter() {
        assertThat(noJitter.delayForAttempt(1)).contains(Duration.ofMinutes(1));
        assertThat(noJitter.delayForAttempt(2)).contains(Duration.ofMinutes(2));
        assertThat(noJitter.delayForAttempt(5)).contains(Duration.ofMinutes(16));
    }

    @Test
    @DisplayName("지터는 지수 지연의 10%를 넘지 않음")
    void jitter_upper_bound() {
        assertThat(maxJitter.delayForAttempt(1)).contains(Duration.ofSeconds(66));
        assertThat(maxJitter.delayForAttempt(3)).contains(Duration.ofSeconds(264));
    }

    @Test
    @DisplayName("지터가 최대여도 다음 시도 지연이 더 큼")
    void strictly_increasing() {
        for (int n = 1; n < 10; n++) {
            Duration worst = maxJitter.delayForAttempt(n).orElseThrow();
            Duration next = noJitter.delayForAttempt(n + 1).orElseThrow();
            assertThat(next).isGreaterThan(worst);
        }
    }

    @Test
    @DisplayName("상한을 넘으면 maxDelay로 고정")
    void capped_at_max_delay() {
        Backoff small = new Backoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 20, 0.0, () -> 0.0);
        assertThat(small.delayForAttempt(4)).contains(Duration.ofSeconds(8));
        assertThat(small.delayForAttempt(15)).contains(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("하드 상한을 넘는 시도는 재시도하지 않음")
    void no_retry_past_ceiling() {
        assertThat(noJitter.delayForAttempt(10)).isPresent();
        assertThat(noJitter.delayForAttempt(11)).isEmpty();
        assertThat(noJitter.hardCeiling()).isEqualTo(10);
    }

    @Test
    @DisplayName("잘못된 설정값은 생성 시 거부")
    void rejects_bad_config() {
        assertThatThrownBy(() -> new Backoff(Duration.ZERO, Duration.ofSeconds(1), 10, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Backoff(Duration.ofSeconds(1), Duration.ofSeconds(1), 0, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
