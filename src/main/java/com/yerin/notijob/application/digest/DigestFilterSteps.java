package com.yerin.notijob.application.digest;

import com.yerin.notijob.domain.step.NotificationStep;

import java.util.List;

public interface DigestFilterSteps {

    /**
     * 트리거를 진행 중인 다이제스트에 합치거나 다이제스트를 건너뛴 결과 스텝 목록.
     * 빈 목록이면 이번 트리거로는 잡을 만들지 않는다.
     */
    List<NotificationStep> execute(DigestFilterStepsCommand command);
}
