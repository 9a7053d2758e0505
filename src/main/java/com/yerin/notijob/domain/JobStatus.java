package com.yerin.notijob.domain;

public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
