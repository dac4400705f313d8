package com.yerin.openshow.global.exception;

import com.yerin.openshow.global.exception.code.JobErrorCode;
import lombok.Getter;

@Getter
public class JobNotLeasedException extends AppException {

    private final String jobId;
    private final String workerId;

    public JobNotLeasedException(String jobId, String workerId) {
        super(JobErrorCode.JOB_NOT_LEASED_OR_NOT_FOUND);
        this.jobId = jobId;
        this.workerId = workerId;
    }
}
