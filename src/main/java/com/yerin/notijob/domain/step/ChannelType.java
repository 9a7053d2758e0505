package com.yerin.notijob.domain.step;

public enum ChannelType {
    IN_APP,
    EMAIL,
    SMS,
    CHAT,
    PUSH
}
