package com.yerin.notijob.domain.step;

public enum DigestType {
    REGULAR,
    BACKOFF
}
