package com.yerin.openshow.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.openshow.application.JobHandler;
import com.yerin.openshow.application.JobHandlerRegistry;
import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobqMetrics;
import com.yerin.openshow.global.exception.JobNotLeasedException;
import com.yerin.openshow.service.FailureReport;
import com.yerin.openshow.service.JobQueueService;
import com.yerin.openshow.service.LeaseCommand;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * In-process worker: for each registered {@link JobHandler} type, leases jobs of that type,
 * runs the handler and reports exactly one outcome per lease.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "jobq.worker", name = "enabled", havingValue = "true")
public class WorkerRunner {
    private final JobQueueService jobQueueService;
    private final JobHandlerRegistry registry;
    private final JobqMetrics metrics;
    private final JsonPayloads json;

    @Value("${jobq.worker.batch-size:5}")
    private int batchSize;

    @Value("${jobq.worker.poll-interval-millis:1000}")
    private long pollIntervalMillis;

    @Value("${jobq.worker.concurrency:1}")
    private int concurrency;

    private ExecutorService workers;

    @PostConstruct
    void startWorkers() {
        if (registry.types().isEmpty()) {
            log.info("[Worker] no handlers registered, worker not started");
            return;
        }

        workers = Executors.newFixedThreadPool(concurrency * registry.types().size());
        for (String type : registry.types()) {
            for (int i = 0; i < concurrency; i++) {
                final String workerId = WorkerId.consumerName() + "-" + i;
                workers.submit(() -> pollLoop(type, workerId));
            }
        }
        log.info("[Worker] started {} consumers per type for types={}", concurrency, registry.types());
    }

    @PreDestroy
    void stopWorkers() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    private void pollLoop(String type, String workerId) {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                if (pollOnce(type, workerId) == 0) {
                    Thread.sleep(pollIntervalMillis);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.warn("[Worker] poll loop error: {}", e.toString());
                try { Thread.sleep(pollIntervalMillis); } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Leases one batch of {@code type} and processes it.
     *
     * @return number of jobs leased
     */
    public int pollOnce(String type, String workerId) {
        List<Job> leased = jobQueueService.lease(LeaseCommand.builder()
                .workerId(workerId)
                .jobType(type)
                .limit(batchSize)
                .build());

        for (Job job : leased) {
            process(job, workerId);
        }
        return leased.size();
    }

    private void process(Job job, String workerId) {
        JsonNode result;
        long start = System.nanoTime();
        try {
            JobHandler handler = registry.get(job.getType());
            if (handler == null) throw new IllegalStateException("No handler for type=" + job.getType());
            result = handler.handle(job.getJobId(), json.read(job.getPayloadJson()));
        } catch (Exception ex) {
            log.warn("[Worker] handler failed jobId={}, attempt={}, err={}", job.getJobId(), job.getAttempt(), ex.toString());
            report(() -> jobQueueService.reportFailure(job.getJobId(), workerId,
                    new FailureReport(ex.getClass().getSimpleName(), String.valueOf(ex.getMessage()))), job);
            return;
        } finally {
            metrics.handlerTimer(job.getType()).record(Duration.ofNanos(System.nanoTime() - start));
        }

        JsonNode output = result;
        report(() -> jobQueueService.reportSuccess(job.getJobId(), workerId, output), job);
    }

    private void report(Runnable call, Job job) {
        try {
            call.run();
        } catch (JobNotLeasedException e) {
            // 리스를 잃었으면 다른 워커나 다음 재시도가 작업을 가져간 것이므로 보고를 버린다
            log.warn("[Worker] lease lost before report jobId={}", job.getJobId());
        }
    }
}
