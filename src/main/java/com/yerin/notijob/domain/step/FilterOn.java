package com.yerin.notijob.domain.step;

public enum FilterOn {
    PAYLOAD,
    SUBSCRIBER,
    WEBHOOK
}
