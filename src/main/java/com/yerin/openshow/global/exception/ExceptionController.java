package com.yerin.openshow.global.exception;

import com.yerin.openshow.global.dto.ErrorResponse;
import com.yerin.openshow.global.exception.code.CommonErrorCode;
import com.yerin.openshow.global.exception.code.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

@Slf4j
@RestControllerAdvice
public class ExceptionController {

    private static final String WORKER_HEADER = "X-Worker-Id";

    @ExceptionHandler(AppException.class)
    public ResponseEntity<ErrorResponse> handleAppException(AppException e,
                                                            HttpServletRequest request) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.isServerError()) {
            log.error("AppException: {}, path={} {}", errorCode.getMessage(),
                    request.getMethod(), request.getRequestURI(), e);
        } else {
            log.warn("AppException: {}, path={} {}", errorCode.getMessage(),
                    request.getMethod(), request.getRequestURI());
        }

        ErrorResponse body = ErrorResponse.of(errorCode, request, e.getDetails());
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e,
                                                          HttpServletRequest request) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String msg = (fieldError != null)
                ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                : "입력값이 유효하지 않습니다.";

        List<String> details = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();

        ErrorCode errorCode = CommonErrorCode.INVALID_PARAMETER.withDetail(msg);
        log.warn("Validation failed: {}, path={} {}", msg,
                request.getMethod(), request.getRequestURI());

        ErrorResponse body = ErrorResponse.of(errorCode, request, details);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e,
                                                             HttpServletRequest request) {
        ErrorCode errorCode = WORKER_HEADER.equalsIgnoreCase(e.getHeaderName())
                ? CommonErrorCode.MISSING_WORKER_HEADER
                : CommonErrorCode.INVALID_PARAMETER.withDetail(e.getHeaderName() + " 헤더가 필요합니다.");
        log.warn("Missing header: {}, path={} {}", e.getHeaderName(),
                request.getMethod(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.of(errorCode, request));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e,
                                                          HttpServletRequest request) {
        log.warn("Bad request: {}, path={} {}", e.getMessage(),
                request.getMethod(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(CommonErrorCode.MALFORMED_REQUEST, request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAll(Exception e,
                                                   HttpServletRequest request) {
        log.error("Unhandled exception: ", e);
        ErrorResponse body = ErrorResponse.of(CommonErrorCode.INTERNAL_SERVER_ERROR, request);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
