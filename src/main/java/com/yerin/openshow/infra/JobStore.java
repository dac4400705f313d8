package com.yerin.openshow.infra;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobStatus;
import com.yerin.openshow.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.IntSupplier;

/**
 * Persisted job records. Every state change is a conditional update whose predicate names the
 * state the caller expects; a zero row count means someone else got there first.
 */
@Slf4j
@Component
public class JobStore {

    static final int CANDIDATE_WINDOW = 10;
    static final int EXHAUSTED_WINDOW = 100;

    static final String LEASE_EXPIRED_CODE = "lease_expired";

    private final JobRepository jobRepository;
    private final TransactionTemplate tx;

    public JobStore(JobRepository jobRepository, PlatformTransactionManager txManager) {
        this.jobRepository = jobRepository;
        this.tx = new TransactionTemplate(txManager);
    }

    /** A granted lease. {@code previousWorkerId} is set when an expired lease was taken over. */
    public record Claim(Job job, String previousWorkerId) {
        public boolean reclaimed() {
            return previousWorkerId != null;
        }
    }

    public Job insert(Job job) {
        return jobRepository.save(job);
    }

    public Optional<Job> findByJobId(String jobId) {
        return jobRepository.findByJobId(jobId);
    }

    public Optional<Job> findLeased(String jobId, String workerId) {
        return jobRepository.findByJobIdAndWorkerIdAndStatus(jobId, workerId, JobStatus.LEASED);
    }

    /**
     * Finds the best leasable job and claims it for {@code workerId}, incrementing its attempt.
     * Expired leases that already used their last attempt are dead-lettered first and passed to
     * {@code onExhaustedLease}; they never take part in the candidate scan.
     * Candidates are read in priority/nextRunAt order and the claim re-checks the whole selection
     * predicate. A lost race means another worker took that job, so the scan repeats until a claim
     * succeeds or nothing matches.
     */
    public Optional<Claim> claimOne(String workerId, String type, Instant now, Instant leaseExpiresAt,
                                    Consumer<Job> onExhaustedLease) {
        deadLetterExhaustedLeases(type, now, onExhaustedLease);

        while (true) {
            List<Job> candidates = findCandidates(type, now);
            if (candidates.isEmpty()) {
                return Optional.empty();
            }

            for (Job candidate : candidates) {
                Optional<Job> claimed = tx.execute(status -> {
                    int updated = jobRepository.claimIfLeasable(candidate.getId(), workerId, leaseExpiresAt, now);
                    return updated == 1 ? jobRepository.findById(candidate.getId()) : Optional.<Job>empty();
                });
                if (claimed != null && claimed.isPresent()) {
                    String previous = candidate.getStatus() == JobStatus.LEASED ? candidate.getWorkerId() : null;
                    return Optional.of(new Claim(claimed.get(), previous));
                }
                log.debug("[JobStore] lost race jobId={}, workerId={}", candidate.getJobId(), workerId);
            }
        }
    }

    /**
     * Moves every expired final-attempt lease (optionally of one type) to DLQ.
     *
     * @return number of jobs this call dead-lettered
     */
    public int deadLetterExhaustedLeases(String type, Instant now, Consumer<Job> onDeadLettered) {
        int moved = 0;
        while (true) {
            Pageable window = PageRequest.of(0, EXHAUSTED_WINDOW);
            List<Job> exhausted = type == null
                    ? jobRepository.findExhaustedLeases(now, window)
                    : jobRepository.findExhaustedLeasesByType(type, now, window);
            if (exhausted.isEmpty()) {
                return moved;
            }
            for (Job job : exhausted) {
                if (deadLetterExhausted(job, now)) {
                    onDeadLettered.accept(job);
                    moved++;
                }
            }
        }
    }

    public Optional<Job> markSucceeded(String jobId, String workerId, String resultJson, Instant now) {
        return updateAndReload(jobId, () -> jobRepository.succeedIfLeased(jobId, workerId, resultJson, now));
    }

    public Optional<Job> reschedule(String jobId, String workerId, int attempt, Instant nextRunAt,
                                    String errorCode, String errorMessage, Instant now) {
        return updateAndReload(jobId, () -> jobRepository.rescheduleIfLeased(
                jobId, workerId, attempt, nextRunAt, errorCode, errorMessage, now));
    }

    public Optional<Job> deadLetter(String jobId, String workerId, int attempt,
                                    String errorCode, String errorMessage, Instant now) {
        return updateAndReload(jobId, () -> jobRepository.deadLetterIfLeased(
                jobId, workerId, attempt, errorCode, errorMessage, now));
    }

    public List<Job> findExpiredLeases(Instant now) {
        return jobRepository.findTop100ByStatusAndLeaseExpiresAtLessThanEqualOrderByLeaseExpiresAtAsc(
                JobStatus.LEASED, now);
    }

    public boolean requeueExpired(Job job, Instant now) {
        Integer updated = tx.execute(status -> jobRepository.requeueIfExpired(job.getId(), now));
        return updated != null && updated == 1;
    }

    public boolean deadLetterExhausted(Job job, Instant now) {
        Integer updated = tx.execute(status -> jobRepository.deadLetterIfExhaustedAndExpired(
                job.getId(), LEASE_EXPIRED_CODE,
                "lease expired on final attempt " + job.getAttempt() + "/" + job.getMaxAttempts(), now));
        return updated != null && updated == 1;
    }

    public Page<Job> search(JobStatus status, String type, Pageable pageable) {
        Specification<Job> spec = (root, query, cb) -> cb.conjunction();
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        if (type != null && !type.isBlank()) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("type"), type));
        }
        return jobRepository.findAll(spec, pageable);
    }

    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, jobRepository.countByStatus(status));
        }
        return counts;
    }

    private List<Job> findCandidates(String type, Instant now) {
        Pageable window = PageRequest.of(0, CANDIDATE_WINDOW);
        return type == null
                ? jobRepository.findLeasable(now, window)
                : jobRepository.findLeasableByType(type, now, window);
    }

    private Optional<Job> updateAndReload(String jobId, IntSupplier update) {
        Optional<Job> result = tx.execute(status ->
                update.getAsInt() == 1 ? jobRepository.findByJobId(jobId) : Optional.<Job>empty());
        return result == null ? Optional.empty() : result;
    }
}
