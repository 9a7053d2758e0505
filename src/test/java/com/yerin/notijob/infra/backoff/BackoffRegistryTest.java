package com.yerin.notijob.infra.backoff;

import com.yerin.notijob.domain.queue.BackoffStrategy;
import com.yerin.notijob.domain.queue.QueuedJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("백오프 레지스트리 테스트")
class BackoffRegistryTest {

    private static BackoffStrategyFunction fixed(long millis) {
        return new BackoffStrategyFunction() {
            @Override
            public BackoffStrategy strategy() {
                return BackoffStrategy.WEBHOOK_FILTER_BACKOFF;
            }

            @Override
            public long delayMillis(int attemptsMade, Throwable error, QueuedJob job) {
                return millis;
            }
        };
    }

    @Test
    @DisplayName("등록된 함수로 지연을 계산한다")
    void resolves_registered() {
        BackoffRegistry registry = new BackoffRegistry(List.of(fixed(42)));

        assertThat(registry.delay(BackoffStrategy.WEBHOOK_FILTER_BACKOFF, 1, new RuntimeException(), null)).isEqualTo(42);
        assertThat(registry.strategies()).containsExactly(BackoffStrategy.WEBHOOK_FILTER_BACKOFF);
    }

    @Test
    @DisplayName("음수 지연은 0으로 자른다")
    void negative_delay_clamped() {
        BackoffRegistry registry = new BackoffRegistry(List.of(fixed(-5)));

        assertThat(registry.delay(BackoffStrategy.WEBHOOK_FILTER_BACKOFF, 1, null, null)).isZero();
    }

    @Test
    @DisplayName("함수가 없는 전략이 있으면 기동 실패")
    void missing_function_fails() {
        assertThatThrownBy(() -> new BackoffRegistry(List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("webhookFilterBackoff");
    }

    @Test
    @DisplayName("같은 전략에 함수가 둘이면 기동 실패")
    void duplicate_function_fails() {
        assertThatThrownBy(() -> new BackoffRegistry(List.of(fixed(1), fixed(2))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    @DisplayName("웹훅 필터 전략: base * 2^(attempt-1), 상한 적용")
    void webhook_filter_strategy() {
        WebhookFilterBackoffStrategy strategy = new WebhookFilterBackoffStrategy(1000, 5000, 0.0);

        assertThat(strategy.delayMillis(1, null, null)).isEqualTo(1000);
        assertThat(strategy.delayMillis(2, null, null)).isEqualTo(2000);
        assertThat(strategy.delayMillis(3, null, null)).isEqualTo(4000);
        assertThat(strategy.delayMillis(4, null, null)).isEqualTo(5000);
    }
}
