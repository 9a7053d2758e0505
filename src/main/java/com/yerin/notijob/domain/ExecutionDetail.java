package com.yerin.notijob.domain;

public enum ExecutionDetail {
    STEP_FAILED,
    WEBHOOK_FILTER_FAILED_LAST_RETRY
}
