package com.yerin.openshow.global.exception.code;

import org.springframework.http.HttpStatus;

/**
 * Error contract shared by {@link CommonErrorCode} and {@link JobErrorCode}. The code string is the
 * stable identifier clients match on; the message is for humans and may be narrowed per request.
 */
public interface ErrorCode {
    HttpStatus getHttpStatus();
    String getMessage();
    String getCode();

    default boolean isServerError() {
        return getHttpStatus().is5xxServerError();
    }

    /** Same status and code, with a message describing this particular failure. */
    default ErrorCode withDetail(String detailMessage) {
        return new Detailed(this, detailMessage);
    }

    record Detailed(ErrorCode base, String message) implements ErrorCode {

        public Detailed {
            if (base instanceof Detailed nested) {
                base = nested.base();
            }
        }

        @Override
        public HttpStatus getHttpStatus() {
            return base.getHttpStatus();
        }

        @Override
        public String getMessage() {
            return message == null || message.isBlank() ? base.getMessage() : message;
        }

        @Override
        public String getCode() {
            return base.getCode();
        }
    }
}
