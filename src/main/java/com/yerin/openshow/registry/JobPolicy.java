package com.yerin.openshow.registry;

/**
 * Execution policy of a job type.
 *
 * @param maxAttempts          default ceiling for {@code attempt}, used when enqueue gives no override
 * @param leaseDurationSeconds lease length handed out when a worker leases with this type as filter
 * @param concurrencyLimit     advisory only; the queue does not enforce it. {@code null} when unset
 */
public record JobPolicy(int maxAttempts, int leaseDurationSeconds, Integer concurrencyLimit) {

    public JobPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
        }
        if (leaseDurationSeconds < 1) {
            throw new IllegalArgumentException("leaseDurationSeconds must be >= 1 but was " + leaseDurationSeconds);
        }
    }
}
