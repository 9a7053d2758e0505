package com.yerin.notijob.application;

import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.step.StepType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * 채널 프로바이더 연동 대신 전송 내용을 로그로 남기는 기본 핸들러.
 */
@Slf4j
@Profile("!test")
@Component
public class LoggingDeliveryHandler implements ChannelStepHandler {

    @Value("${notijob.handler.logging.fail-always:false}")
    private boolean failAlways;

    @Override
    public Set<StepType> types() {
        return EnumSet.of(StepType.IN_APP, StepType.EMAIL, StepType.SMS, StepType.CHAT, StepType.PUSH,
                StepType.DELAY, StepType.TRIGGER);
    }

    @Override
    public void handle(JobEntity job) {
        if (failAlways) throw new IllegalStateException("delivery forced to fail jobId=" + job.getId());

        log.info("[Handler.{}] jobId={}, subscriberId={}, providerId={}, templateId={}",
                job.getType(), job.getId(), job.getSubscriberId(), job.getProviderId(),
                job.getStep() == null || job.getStep().template() == null ? null : job.getStep().template().id());
    }
}
