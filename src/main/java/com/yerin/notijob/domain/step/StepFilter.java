package com.yerin.notijob.domain.step;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record StepFilter(
        @JsonProperty("isNegated") boolean isNegated,
        String type,
        String value,
        List<FilterChild> children
) {
    public boolean hasChildOn(FilterOn on) {
        return children != null && children.stream().anyMatch(c -> c.on() == on);
    }
}
