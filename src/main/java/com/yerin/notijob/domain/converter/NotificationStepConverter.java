package com.yerin.notijob.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.notijob.domain.step.NotificationStep;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class NotificationStepConverter implements AttributeConverter<NotificationStep, String> {

    private static final ObjectMapper om = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(NotificationStep step) {
        if (step == null) return null;
        try {
            return om.writeValueAsString(step);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("step serialize error", e);
        }
    }

    @Override
    public NotificationStep convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return om.readValue(json, NotificationStep.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("step parse error", e);
        }
    }
}
