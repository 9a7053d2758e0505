package com.yerin.notijob.infra.backoff;

import com.yerin.notijob.domain.queue.BackoffStrategy;
import com.yerin.notijob.domain.queue.QueuedJob;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 웹훅 필터가 아직 통과하지 못한 잡의 재시도 간격. 첫 재시도는 base, 이후 두 배씩 늘어난다.
 */
@Component
public class WebhookFilterBackoffStrategy implements BackoffStrategyFunction {

    private final long baseMillis;
    private final long capMillis;
    private final double jitterRatio;

    public WebhookFilterBackoffStrategy(@Value("${notijob.backoff.webhook-filter.base-millis:1000}") long baseMillis,
                                        @Value("${notijob.backoff.webhook-filter.cap-millis:60000}") long capMillis,
                                        @Value("${notijob.backoff.webhook-filter.jitter-ratio:0.2}") double jitterRatio) {
        this.baseMillis = baseMillis;
        this.capMillis = capMillis;
        this.jitterRatio = jitterRatio;
    }

    @Override
    public BackoffStrategy strategy() {
        return BackoffStrategy.WEBHOOK_FILTER_BACKOFF;
    }

    @Override
    public long delayMillis(int attemptsMade, Throwable error, QueuedJob job) {
        return Backoff.expJitter(attemptsMade - 1, baseMillis, capMillis, jitterRatio).toMillis();
    }
}
