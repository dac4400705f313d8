package com.yerin.openshow.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/** Request-level failures that happen before a job is ever looked up. */
@Getter
@RequiredArgsConstructor
public enum CommonErrorCode implements ErrorCode {
    MALFORMED_REQUEST(HttpStatus.BAD_REQUEST, "요청 본문이나 파라미터 형식을 읽을 수 없습니다.", "COMMON-001"),
    INVALID_PARAMETER(HttpStatus.BAD_REQUEST, "요청 파라미터가 허용 범위를 벗어났습니다.", "COMMON-002"),
    MISSING_WORKER_HEADER(HttpStatus.BAD_REQUEST, "워커 식별 헤더(X-Worker-Id)가 필요합니다.", "COMMON-003"),
    ADMIN_TOKEN_REJECTED(HttpStatus.UNAUTHORIZED, "관리자 토큰(X-Admin-Token)이 없거나 일치하지 않습니다.", "COMMON-004"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "작업 큐 처리 중 서버 에러가 발생했습니다.", "COMMON-005");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
