package com.yerin.notijob.infra.backoff;

import com.yerin.notijob.domain.queue.BackoffStrategy;
import com.yerin.notijob.domain.queue.QueuedJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 백오프 전략 레지스트리.
 * <ul>
 *   <li>모든 {@link BackoffStrategy} 상수에 함수가 정확히 하나 있어야 기동된다</li>
 *   <li>기동 이후에는 읽기 전용</li>
 * </ul>
 */
@Slf4j
@Component
public class BackoffRegistry {

    private final Map<BackoffStrategy, BackoffStrategyFunction> functions = new EnumMap<>(BackoffStrategy.class);

    public BackoffRegistry(List<BackoffStrategyFunction> discovered) {
        for (BackoffStrategyFunction fn : discovered) {
            BackoffStrategyFunction prev = functions.putIfAbsent(fn.strategy(), fn);
            if (prev != null) {
                throw new IllegalStateException("duplicate backoff function for strategy=" + fn.strategy().typeName()
                        + " (" + prev.getClass().getSimpleName() + ", " + fn.getClass().getSimpleName() + ")");
            }
        }
        for (BackoffStrategy strategy : BackoffStrategy.values()) {
            if (!functions.containsKey(strategy)) {
                throw new IllegalStateException("no backoff function registered for strategy=" + strategy.typeName());
            }
        }
        log.info("[Backoff] registered strategies={}", functions.keySet());
    }

    public BackoffStrategyFunction resolve(BackoffStrategy strategy) {
        BackoffStrategyFunction fn = functions.get(strategy);
        if (fn == null) {
            throw new IllegalArgumentException("unknown backoff strategy: " + strategy);
        }
        return fn;
    }

    public long delay(BackoffStrategy strategy, int attemptsMade, Throwable error, QueuedJob job) {
        return Math.max(0, resolve(strategy).delayMillis(attemptsMade, error, job));
    }

    public Set<BackoffStrategy> strategies() {
        return Collections.unmodifiableSet(functions.keySet());
    }
}
