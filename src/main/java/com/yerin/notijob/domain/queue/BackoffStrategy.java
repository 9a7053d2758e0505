package com.yerin.notijob.domain.queue;

/**
 * 큐 옵션에 실리는 백오프 전략 이름. 각 상수는 기동 시 BackoffRegistry 에 함수가 등록되어 있어야 한다.
 */
public enum BackoffStrategy {
    WEBHOOK_FILTER_BACKOFF("webhookFilterBackoff");

    private final String typeName;

    BackoffStrategy(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
