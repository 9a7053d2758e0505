package com.yerin.notijob.infra.backoff;

import com.yerin.notijob.domain.queue.BackoffStrategy;
import com.yerin.notijob.domain.queue.QueuedJob;

/**
 * 큐 옵션에 실린 백오프 전략 이름에 대응하는 지연 계산 함수. 스프링 빈으로 등록하면 {@link BackoffRegistry} 가 모은다.
 */
public interface BackoffStrategyFunction {

    BackoffStrategy strategy();

    /**
     * @param attemptsMade 이번 실패를 포함한 실행 횟수 (1부터)
     * @return 다음 실행까지 기다릴 밀리초
     */
    long delayMillis(int attemptsMade, Throwable error, QueuedJob job);
}
