package com.yerin.notijob.domain.step;

import java.time.Duration;

public enum DigestUnit {
    SECONDS(Duration.ofSeconds(1)),
    MINUTES(Duration.ofMinutes(1)),
    HOURS(Duration.ofHours(1)),
    DAYS(Duration.ofDays(1));

    private final Duration unit;

    DigestUnit(Duration unit) {
        this.unit = unit;
    }

    public Duration times(long amount) {
        return unit.multipliedBy(amount);
    }
}
