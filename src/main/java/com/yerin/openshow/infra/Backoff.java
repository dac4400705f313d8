package com.yerin.openshow.infra;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential retry delay with additive jitter.
 * <p>
 * {@code delay(n) = base * 2^(n-1) + U[0, jitterRatio * base * 2^(n-1)]}, capped at {@code maxDelay}.
 * Attempts above {@code hardCeiling} get no delay at all, which callers treat as "do not retry".
 */
public final class Backoff {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int hardCeiling;
    private final double jitterRatio;
    private final DoubleSupplier jitterSource;

    public Backoff(Duration baseDelay, Duration maxDelay, int hardCeiling, double jitterRatio,
                   DoubleSupplier jitterSource) {
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be smaller than baseDelay");
        }
        if (hardCeiling < 1) {
            throw new IllegalArgumentException("hardCeiling must be >= 1");
        }
        if (jitterRatio < 0) {
            throw new IllegalArgumentException("jitterRatio must not be negative");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.hardCeiling = hardCeiling;
        this.jitterRatio = jitterRatio;
        this.jitterSource = jitterSource;
    }

    public Backoff(Duration baseDelay, Duration maxDelay, int hardCeiling, double jitterRatio) {
        this(baseDelay, maxDelay, hardCeiling, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param attempt 1-based attempt number the delay leads up to
     * @return the delay, or empty once {@code attempt} is past the hard ceiling
     */
    public Optional<Duration> delayForAttempt(int attempt) {
        if (attempt > hardCeiling) {
            return Optional.empty();
        }
        int exponent = Math.max(0, attempt - 1);
        long capMillis = maxDelay.toMillis();
        long exp = (long) Math.min((double) capMillis, baseDelay.toMillis() * Math.pow(2, exponent));
        double draw = Math.min(1.0, Math.max(0.0, jitterSource.getAsDouble()));
        long jitter = (long) (exp * jitterRatio * draw);
        return Optional.of(Duration.ofMillis(exp + jitter));
    }

    public int hardCeiling() {
        return hardCeiling;
    }
}
