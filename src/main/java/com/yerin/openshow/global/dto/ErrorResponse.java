package com.yerin.openshow.global.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.openshow.global.exception.code.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        int status,
        String code,
        String message,
        String path,
        Instant timestamp,
        List<String> details
) {
    public static ErrorResponse of(ErrorCode errorCode, HttpServletRequest request) {
        return of(errorCode, request, List.of());
    }

    public static ErrorResponse of(ErrorCode errorCode, HttpServletRequest request, List<String> details) {
        return new ErrorResponse(
                errorCode.getHttpStatus().value(),
                errorCode.getCode(),
                errorCode.getMessage(),
                request.getRequestURI(),
                Instant.now(),
                details
        );
    }
}
