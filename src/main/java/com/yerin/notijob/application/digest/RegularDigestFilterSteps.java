package com.yerin.notijob.application.digest;

import com.yerin.notijob.domain.JobStatus;
import com.yerin.notijob.domain.step.DigestMetadata;
import com.yerin.notijob.domain.step.DigestType;
import com.yerin.notijob.domain.step.NotificationStep;
import com.yerin.notijob.domain.step.StepType;
import com.yerin.notijob.repository.JobRepository;
import com.yerin.notijob.repository.NotificationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 구독자+템플릿 단위 다이제스트 윈도우 판정.
 * 호출 측이 {@link #lockResource} 락을 잡은 채로, 새 잡 저장과 커밋까지 같은 락 안에서 불러야 한다.
 * <ul>
 *   <li>대기 중인 다이제스트 잡이 있으면 그 잡에 합쳐지고 빈 목록을 돌려준다</li>
 *   <li>REGULAR: 새 윈도우를 연다 (스텝 그대로)</li>
 *   <li>BACKOFF: 백오프 윈도우 안에 다른 알림이 없으면 다이제스트 스텝을 건너뛴다</li>
 * </ul>
 */
@Slf4j
@Service
public class RegularDigestFilterSteps implements DigestFilterSteps {

    private final JobRepository jobRepository;
    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public RegularDigestFilterSteps(JobRepository jobRepository,
                                    NotificationRepository notificationRepository) {
        this(jobRepository, notificationRepository, Clock.systemUTC());
    }

    RegularDigestFilterSteps(JobRepository jobRepository,
                             NotificationRepository notificationRepository,
                             Clock clock) {
        this.jobRepository = jobRepository;
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    public static String lockResource(String environmentId, String subscriberRefId, String templateId) {
        return "digest:" + environmentId + ":" + subscriberRefId + ":" + templateId;
    }

    @Override
    public List<NotificationStep> execute(DigestFilterStepsCommand command) {
        boolean pendingDigest = jobRepository.existsByEnvironmentIdAndSubscriberRefIdAndTemplateIdAndTypeAndStatus(
                command.environmentId(), command.subscriberRefId(), command.templateId(), StepType.DIGEST, JobStatus.PENDING);
        if (pendingDigest) {
            log.info("[Digest] merged into pending digest subscriberRefId={}, templateId={}, transactionId={}",
                    command.subscriberRefId(), command.templateId(), command.transactionId());
            return List.of();
        }

        if (command.type() != DigestType.BACKOFF) {
            return command.steps();
        }

        NotificationStep digestStep = command.steps().isEmpty() ? null : command.steps().get(0);
        DigestMetadata metadata = digestStep == null ? null : digestStep.metadata();
        Duration backoff = metadata == null ? Duration.ZERO : metadata.backoffWindow();
        if (backoff.isZero()) {
            return command.steps();
        }

        Instant since = clock.instant().minus(backoff);
        boolean recentTrigger = notificationRepository.existsByEnvironmentIdAndSubscriberRefIdAndTemplateIdAndCreatedAtAfterAndIdNot(
                command.environmentId(), command.subscriberRefId(), command.templateId(), since, command.notificationId());
        if (recentTrigger) {
            return command.steps();
        }

        log.debug("[Digest] no trigger within backoff={}, skip digest subscriberRefId={}", backoff, command.subscriberRefId());
        return command.steps().stream().filter(s -> s != digestStep).toList();
    }
}
