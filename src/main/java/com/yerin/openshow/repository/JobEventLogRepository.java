package com.yerin.openshow.repository;

import com.yerin.openshow.domain.JobEventLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JobEventLogRepository extends JpaRepository<JobEventLog, Long> {
    List<JobEventLog> findByJobIdOrderByIdAsc(String jobId);
}
