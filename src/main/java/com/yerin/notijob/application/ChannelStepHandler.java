package com.yerin.notijob.application;

import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.step.StepType;

import java.util.Optional;
import java.util.Set;

/**
 * 스텝 타입별 실행기. 여러 워커 스레드에서 동시에 호출된다.
 */
public interface ChannelStepHandler {

    Set<StepType> types();

    void handle(JobEntity job);

    /** 값이 있으면 RunJob 이 해당 리소스 락을 잡은 상태에서 실행한다. */
    default Optional<String> lockResource(JobEntity job) {
        return Optional.empty();
    }
}
