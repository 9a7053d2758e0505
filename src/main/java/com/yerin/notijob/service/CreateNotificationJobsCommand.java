package com.yerin.notijob.service;

import com.yerin.notijob.domain.SubscriberRef;
import com.yerin.notijob.domain.step.ChannelType;
import com.yerin.notijob.domain.step.NotificationTemplate;
import lombok.Builder;

import java.util.Map;

@Builder
public record CreateNotificationJobsCommand(
        String identifier,
        String transactionId,
        String environmentId,
        String organizationId,
        String userId,
        NotificationTemplate template,
        String payloadJson,
        String overridesJson,
        SubscriberRef subscriber,
        String toJson,
        String actorId,
        Map<ChannelType, String> templateProviderIds
) {}
