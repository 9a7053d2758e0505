package com.yerin.notijob.domain.step;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.util.List;

/**
 * 워크플로 템플릿의 한 스텝. 잡 생성 시 그대로 {@code JobEntity.step} 으로 복사된다.
 */
public record NotificationStep(
        String id,
        boolean active,
        boolean shouldStopOnFail,
        MessageTemplate template,
        List<StepFilter> filters,
        DigestMetadata metadata
) {
    @JsonIgnore
    public StepType type() {
        return template == null ? null : template.type();
    }

    @JsonIgnore
    public boolean isDigest() {
        return type() == StepType.DIGEST;
    }

    public boolean containsFilterOn(FilterOn on) {
        return filters != null && filters.stream().anyMatch(f -> f.hasChildOn(on));
    }

    /** DELAY/DIGEST 스텝만 지연을 가진다. */
    @JsonIgnore
    public Duration delay() {
        StepType type = type();
        if (metadata == null || (type != StepType.DELAY && type != StepType.DIGEST)) {
            return Duration.ZERO;
        }
        return metadata.window();
    }

    public NotificationStep withActive(boolean value) {
        return new NotificationStep(id, value, shouldStopOnFail, template, filters, metadata);
    }
}
