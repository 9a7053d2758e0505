package com.yerin.notijob.domain.step;

public record MessageTemplate(
        String id,
        StepType type,
        String content
) {}
