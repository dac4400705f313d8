package com.yerin.openshow.application;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Business logic for one job type, run by {@code WorkerRunner} after a lease is granted.
 * Delivery is at-least-once, so implementations must tolerate running twice for the same job.
 */
public interface JobHandler {

    String type();

    /**
     * @return result document stored on success; {@code null} stores an empty object
     * @throws Exception any failure is reported back to the queue as a failed attempt
     */
    JsonNode handle(String jobId, JsonNode payload) throws Exception;
}
