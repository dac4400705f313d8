package com.yerin.openshow.domain;

public enum JobStatus {
    QUEUED,
    LEASED,
    SUCCEEDED,
    DLQ;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == DLQ;
    }
}
