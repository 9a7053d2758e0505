package com.yerin.notijob.domain.step;

import java.util.Optional;

public enum StepType {
    IN_APP(ChannelType.IN_APP),
    EMAIL(ChannelType.EMAIL),
    SMS(ChannelType.SMS),
    CHAT(ChannelType.CHAT),
    PUSH(ChannelType.PUSH),
    DIGEST(null),
    DELAY(null),
    TRIGGER(null);

    private final ChannelType channel;

    StepType(ChannelType channel) {
        this.channel = channel;
    }

    /** 전송 채널이 없는 스텝(DIGEST/DELAY/TRIGGER)은 empty. */
    public Optional<ChannelType> channel() {
        return Optional.ofNullable(channel);
    }
}
