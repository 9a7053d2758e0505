package com.yerin.notijob.application.digest;

import com.yerin.notijob.domain.step.DigestType;
import com.yerin.notijob.domain.step.NotificationStep;

import java.util.List;

/**
 * @param steps 첫 다이제스트 스텝부터 끝까지의 활성 스텝
 */
public record DigestFilterStepsCommand(
        String subscriberRefId,
        String payloadJson,
        List<NotificationStep> steps,
        String environmentId,
        String organizationId,
        String userId,
        String templateId,
        String notificationId,
        String transactionId,
        DigestType type
) {}
