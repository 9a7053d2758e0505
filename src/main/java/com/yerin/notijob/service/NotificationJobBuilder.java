package com.yerin.notijob.service;

import com.yerin.notijob.application.digest.DigestFilterSteps;
import com.yerin.notijob.application.digest.DigestFilterStepsCommand;
import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.JobStatus;
import com.yerin.notijob.domain.NotificationEntity;
import com.yerin.notijob.domain.step.ChannelType;
import com.yerin.notijob.domain.step.NotificationStep;
import com.yerin.notijob.global.exception.AppException;
import com.yerin.notijob.global.exception.code.CommonErrorCode;
import com.yerin.notijob.global.exception.code.JobErrorCode;
import com.yerin.notijob.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 트리거 한 건을 알림 하나와 스텝별 잡 목록으로 펼친다. 잡은 저장하지 않고 돌려주기만 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationJobBuilder {

    private final NotificationRepository notificationRepository;
    private final DigestFilterSteps digestFilterSteps;

    public NotificationJobs build(CreateNotificationJobsCommand command) {
        validate(command);

        NotificationEntity notification = createNotification(command);
        List<NotificationStep> steps = createSteps(command, notification);

        Map<ChannelType, String> providerIds = command.templateProviderIds() == null ? Map.of() : command.templateProviderIds();
        List<JobEntity> jobs = new ArrayList<>(steps.size());
        for (NotificationStep step : steps) {
            if (step.template() == null || step.type() == null) {
                throw new AppException(JobErrorCode.STEP_TEMPLATE_NOT_FOUND);
            }
            String providerId = step.type().channel().map(providerIds::get).orElse(null);

            jobs.add(JobEntity.builder()
                    .identifier(command.identifier())
                    .payloadJson(command.payloadJson())
                    .overridesJson(command.overridesJson())
                    .step(step)
                    .transactionId(command.transactionId())
                    .notificationId(notification.getId())
                    .environmentId(command.environmentId())
                    .organizationId(command.organizationId())
                    .userId(command.userId())
                    .subscriberId(command.subscriber().subscriberId())
                    .subscriberRefId(command.subscriber().id())
                    .status(JobStatus.PENDING)
                    .templateId(notification.getTemplateId())
                    .type(step.type())
                    .providerId(providerId)
                    .actorId(command.actorId())
                    .attempts(0)
                    .build());
        }

        log.debug("[JobBuilder] transactionId={}, notificationId={}, jobs={}",
                command.transactionId(), notification.getId(), jobs.size());
        return new NotificationJobs(notification, jobs);
    }

    private void validate(CreateNotificationJobsCommand command) {
        if (command.identifier() == null || command.identifier().isBlank()) {
            throw new AppException(CommonErrorCode.INVALID_PARAMETER.withDetail("identifier must not be blank"));
        }
        if (command.transactionId() == null || command.transactionId().isBlank()) {
            throw new AppException(CommonErrorCode.INVALID_PARAMETER.withDetail("transactionId must not be blank"));
        }
        if (command.template() == null || command.template().steps() == null) {
            throw new AppException(CommonErrorCode.INVALID_PARAMETER.withDetail("template with steps is required"));
        }
        if (command.subscriber() == null || command.subscriber().id() == null) {
            throw new AppException(CommonErrorCode.INVALID_PARAMETER.withDetail("subscriber is required"));
        }
    }

    private NotificationEntity createNotification(CreateNotificationJobsCommand command) {
        NotificationEntity notification = NotificationEntity.builder()
                .id(UUID.randomUUID().toString())
                .environmentId(command.environmentId())
                .organizationId(command.organizationId())
                .subscriberRefId(command.subscriber().id())
                .templateId(command.template().id())
                .transactionId(command.transactionId())
                .toJson(command.toJson())
                .payloadJson(command.payloadJson())
                .build();

        NotificationEntity saved;
        try {
            saved = notificationRepository.save(notification);
        } catch (DataAccessException e) {
            log.error("[JobBuilder] notification could not be created transactionId={}, err={}",
                    command.transactionId(), e.toString());
            throw new AppException(JobErrorCode.NOTIFICATION_NOT_CREATED, e);
        }
        if (saved == null) {
            log.error("[JobBuilder] notification could not be created transactionId={}", command.transactionId());
            throw new AppException(JobErrorCode.NOTIFICATION_NOT_CREATED);
        }
        return saved;
    }

    private List<NotificationStep> createSteps(CreateNotificationJobsCommand command, NotificationEntity notification) {
        List<NotificationStep> active = command.template().steps().stream()
                .filter(NotificationStep::active)
                .toList();
        return filterDigestSteps(command, notification, active);
    }

    // 다이제스트가 여러 개여도 첫 번째만 본다
    private List<NotificationStep> filterDigestSteps(CreateNotificationJobsCommand command,
                                                     NotificationEntity notification,
                                                     List<NotificationStep> steps) {
        int digestIdx = -1;
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).isDigest()) {
                digestIdx = i;
                break;
            }
        }
        if (digestIdx < 0) return steps;

        NotificationStep digestStep = steps.get(digestIdx);
        if (digestStep.metadata() == null || digestStep.metadata().type() == null) return steps;

        List<NotificationStep> filteredTail = digestFilterSteps.execute(new DigestFilterStepsCommand(
                command.subscriber().id(),
                command.payloadJson(),
                steps.subList(digestIdx, steps.size()),
                command.environmentId(),
                command.organizationId(),
                command.userId(),
                command.template().id(),
                notification.getId(),
                command.transactionId(),
                digestStep.metadata().type()
        ));

        List<NotificationStep> result = new ArrayList<>(steps.subList(0, digestIdx));
        result.addAll(filteredTail);
        return result;
    }
}
