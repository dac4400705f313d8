package com.yerin.openshow.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "작업을 찾을 수 없습니다.", "JOB-001"),
    JOB_NOT_IN_DLQ(HttpStatus.BAD_REQUEST, "DLQ 상태의 작업만 재실행할 수 있습니다.", "JOB-002"),
    UNKNOWN_JOB_TYPE(HttpStatus.NOT_FOUND, "등록되지 않은 작업 타입입니다.", "JOB-003"),
    PAYLOAD_VALIDATION_FAILED(HttpStatus.UNPROCESSABLE_ENTITY, "작업 페이로드가 스키마와 맞지 않습니다.", "JOB-004"),
    JOB_NOT_LEASED_OR_NOT_FOUND(HttpStatus.CONFLICT, "작업이 없거나 해당 워커가 리스를 보유하고 있지 않습니다.", "JOB-005");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
