package com.yerin.openshow.global.exception;

import com.yerin.openshow.global.exception.code.JobErrorCode;
import lombok.Getter;

@Getter
public class UnknownJobTypeException extends AppException {

    private final String type;

    public UnknownJobTypeException(String type) {
        super(JobErrorCode.UNKNOWN_JOB_TYPE.withDetail("등록되지 않은 작업 타입입니다: " + type));
        this.type = type;
    }
}
