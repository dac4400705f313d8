package com.yerin.openshow.repository;

import com.yerin.openshow.domain.Job;
import com.yerin.openshow.domain.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobRepository extends JpaRepository<Job, Long>, JpaSpecificationExecutor<Job> {

    Optional<Job> findByJobId(String jobId);

    Optional<Job> findByJobIdAndWorkerIdAndStatus(String jobId, String workerId, JobStatus status);

    List<Job> findTop100ByStatusAndLeaseExpiresAtLessThanEqualOrderByLeaseExpiresAtAsc(
            JobStatus status, Instant leaseExpiresAt);

    long countByStatus(JobStatus status);

    @Query("""
       select j from Job j
        where (j.status = com.yerin.openshow.domain.JobStatus.QUEUED
               or (j.status = com.yerin.openshow.domain.JobStatus.LEASED and j.leaseExpiresAt <= :now))
          and j.nextRunAt <= :now
          and j.attempt < j.maxAttempts
        order by j.priority desc, j.nextRunAt asc, j.id asc
       """)
    List<Job> findLeasable(@Param("now") Instant now, Pageable page);

    @Query("""
       select j from Job j
        where (j.status = com.yerin.openshow.domain.JobStatus.QUEUED
               or (j.status = com.yerin.openshow.domain.JobStatus.LEASED and j.leaseExpiresAt <= :now))
          and j.nextRunAt <= :now
          and j.attempt < j.maxAttempts
          and j.type = :type
        order by j.priority desc, j.nextRunAt asc, j.id asc
       """)
    List<Job> findLeasableByType(@Param("type") String type, @Param("now") Instant now, Pageable page);

    // 마지막 시도의 리스가 만료된 작업. 할당 후보에서 빠지고 DLQ로 옮겨진다
    @Query("""
       select j from Job j
        where j.status = com.yerin.openshow.domain.JobStatus.LEASED
          and j.leaseExpiresAt <= :now
          and j.attempt >= j.maxAttempts
        order by j.leaseExpiresAt asc, j.id asc
       """)
    List<Job> findExhaustedLeases(@Param("now") Instant now, Pageable page);

    @Query("""
       select j from Job j
        where j.status = com.yerin.openshow.domain.JobStatus.LEASED
          and j.leaseExpiresAt <= :now
          and j.attempt >= j.maxAttempts
          and j.type = :type
        order by j.leaseExpiresAt asc, j.id asc
       """)
    List<Job> findExhaustedLeasesByType(@Param("type") String type, @Param("now") Instant now, Pageable page);

    // 선택 조건 전체를 다시 검사하므로 동시에 같은 행을 노린 워커 중 하나만 1을 받는다
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.openshow.domain.JobStatus.LEASED,
              j.workerId = :workerId,
              j.leaseExpiresAt = :leaseExpiresAt,
              j.attempt = j.attempt + 1,
              j.updatedAt = :now
        where j.id = :id
          and (j.status = com.yerin.openshow.domain.JobStatus.QUEUED
               or (j.status = com.yerin.openshow.domain.JobStatus.LEASED and j.leaseExpiresAt <= :now))
          and j.nextRunAt <= :now
          and j.attempt < j.maxAttempts
       """)
    int claimIfLeasable(@Param("id") Long id,
                        @Param("workerId") String workerId,
                        @Param("leaseExpiresAt") Instant leaseExpiresAt,
                        @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.openshow.domain.JobStatus.SUCCEEDED,
              j.resultJson = :resultJson,
              j.workerId = null,
              j.leaseExpiresAt = null,
              j.updatedAt = :now
        where j.jobId = :jobId
          and j.workerId = :workerId
          and j.status = com.yerin.openshow.domain.JobStatus.LEASED
       """)
    int succeedIfLeased(@Param("jobId") String jobId,
                        @Param("workerId") String workerId,
                        @Param("resultJson") String resultJson,
                        @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.openshow.domain.JobStatus.QUEUED,
              j.nextRunAt = :nextRunAt,
              j.lastErrorCode = :errorCode,
              j.lastErrorMessage = :errorMessage,
              j.workerId = null,
              j.leaseExpiresAt = null,
              j.updatedAt = :now
        where j.jobId = :jobId
          and j.workerId = :workerId
          and j.status = com.yerin.openshow.domain.JobStatus.LEASED
          and j.attempt = :attempt
       """)
    int rescheduleIfLeased(@Param("jobId") String jobId,
                           @Param("workerId") String workerId,
                           @Param("attempt") int attempt,
                           @Param("nextRunAt") Instant nextRunAt,
                           @Param("errorCode") String errorCode,
                           @Param("errorMessage") String errorMessage,
                           @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.openshow.domain.JobStatus.DLQ,
              j.lastErrorCode = :errorCode,
              j.lastErrorMessage = :errorMessage,
              j.workerId = null,
              j.leaseExpiresAt = null,
              j.updatedAt = :now
        where j.jobId = :jobId
          and j.workerId = :workerId
          and j.status = com.yerin.openshow.domain.JobStatus.LEASED
          and j.attempt = :attempt
       """)
    int deadLetterIfLeased(@Param("jobId") String jobId,
                           @Param("workerId") String workerId,
                           @Param("attempt") int attempt,
                           @Param("errorCode") String errorCode,
                           @Param("errorMessage") String errorMessage,
                           @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.openshow.domain.JobStatus.DLQ,
              j.lastErrorCode = :errorCode,
              j.lastErrorMessage = :errorMessage,
              j.workerId = null,
              j.leaseExpiresAt = null,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.openshow.domain.JobStatus.LEASED
          and j.leaseExpiresAt <= :now
          and j.attempt >= j.maxAttempts
       """)
    int deadLetterIfExhaustedAndExpired(@Param("id") Long id,
                                        @Param("errorCode") String errorCode,
                                        @Param("errorMessage") String errorMessage,
                                        @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.openshow.domain.JobStatus.QUEUED,
              j.workerId = null,
              j.leaseExpiresAt = null,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.openshow.domain.JobStatus.LEASED
          and j.leaseExpiresAt <= :now
          and j.attempt < j.maxAttempts
       """)
    int requeueIfExpired(@Param("id") Long id, @Param("now") Instant now);
}
