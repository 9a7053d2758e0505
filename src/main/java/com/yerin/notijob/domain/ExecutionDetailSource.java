package com.yerin.notijob.domain;

public enum ExecutionDetailSource {
    INTERNAL,
    WEBHOOK
}
