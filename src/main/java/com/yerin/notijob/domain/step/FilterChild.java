package com.yerin.notijob.domain.step;

public record FilterChild(
        String field,
        String value,
        String operator,
        FilterOn on
) {}
