package com.yerin.openshow.service;

public record FailureReport(String code, String message) {

    public static final String DEFAULT_CODE = "worker_fail";

    public static FailureReport of(String message) {
        return new FailureReport(DEFAULT_CODE, message);
    }

    public String codeOrDefault() {
        return code == null || code.isBlank() ? DEFAULT_CODE : code;
    }

    public String messageOrDefault() {
        return message == null || message.isBlank() ? "Unknown error" : message;
    }
}
