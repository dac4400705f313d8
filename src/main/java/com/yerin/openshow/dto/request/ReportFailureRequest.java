package com.yerin.openshow.dto.request;

import com.yerin.openshow.service.FailureReport;

public record ReportFailureRequest(ErrorBody error) {

    public record ErrorBody(String code, String message) {
    }

    public FailureReport toReport() {
        return error == null ? FailureReport.of(null) : new FailureReport(error.code(), error.message());
    }
}
