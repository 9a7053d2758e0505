package com.yerin.notijob.application;

import com.yerin.notijob.domain.step.StepType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class StepHandlerRegistry {
    private final Map<StepType, ChannelStepHandler> map = new EnumMap<>(StepType.class);

    public StepHandlerRegistry(List<ChannelStepHandler> handlers) {
        for (ChannelStepHandler h : handlers) {
            for (StepType type : h.types()) {
                ChannelStepHandler prev = map.putIfAbsent(type, h);
                if (prev != null) {
                    throw new IllegalStateException("duplicate step handler for type=" + type
                            + " (" + prev.getClass().getSimpleName() + ", " + h.getClass().getSimpleName() + ")");
                }
            }
        }
    }

    public Optional<ChannelStepHandler> get(StepType type) {
        return type == null ? Optional.empty() : Optional.ofNullable(map.get(type));
    }
}
