package com.yerin.notijob.application;

import com.yerin.notijob.application.digest.RegularDigestFilterSteps;
import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.step.StepType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * 다이제스트 윈도우를 닫는다. 다이제스트 필터와 같은 락을 잡으므로 닫히는 도중에 새 트리거가 합쳐지지 않는다.
 */
@Slf4j
@Component
public class DigestStepHandler implements ChannelStepHandler {

    @Override
    public Set<StepType> types() {
        return Set.of(StepType.DIGEST);
    }

    @Override
    public void handle(JobEntity job) {
        log.info("[Handler.DIGEST] window closed jobId={}, subscriberRefId={}, window={}",
                job.getId(), job.getSubscriberRefId(), job.getDigest() == null ? null : job.getDigest().window());
    }

    @Override
    public Optional<String> lockResource(JobEntity job) {
        return Optional.of(RegularDigestFilterSteps.lockResource(
                job.getEnvironmentId(), job.getSubscriberRefId(), job.getTemplateId()));
    }
}
