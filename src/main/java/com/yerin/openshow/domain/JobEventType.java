package com.yerin.openshow.domain;

public enum JobEventType {
    ENQUEUED,
    LEASED,
    RECLAIMED,
    SUCCEEDED,
    RETRY,
    DLQ,
    REPLAYED
}
