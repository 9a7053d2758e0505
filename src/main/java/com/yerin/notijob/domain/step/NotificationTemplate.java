package com.yerin.notijob.domain.step;

import java.util.List;
import java.util.Optional;

/** 워크플로 템플릿. 스텝 순서가 곧 잡 체인 순서다. */
public record NotificationTemplate(
        String id,
        String name,
        List<NotificationStep> steps
) {
    public Optional<NotificationStep> firstActiveDigest() {
        if (steps == null) return Optional.empty();
        return steps.stream()
                .filter(NotificationStep::active)
                .filter(NotificationStep::isDigest)
                .findFirst();
    }
}
