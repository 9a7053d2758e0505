package com.yerin.notijob.domain;

public enum ExecutionDetailStatus {
    PENDING,
    SUCCESS,
    FAILED
}
