package com.yerin.openshow.global.exception;

import com.yerin.openshow.global.exception.code.ErrorCode;
import lombok.Getter;

import java.util.List;

@Getter
public class AppException extends RuntimeException {

    private final ErrorCode errorCode;

    public AppException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    /** Extra items rendered as {@code details} in the error body. */
    public List<String> getDetails() {
        return List.of();
    }
}
