package com.yerin.notijob.lock;

import com.yerin.notijob.global.exception.LockAcquisitionException;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * 여러 락 노드 과반에 같은 토큰을 기록하는 방식의 분산 락 (Redlock).
 * 소수 노드의 실패는 errorObserver 로만 전달되고 획득을 막지 않는다.
 */
public class QuorumLock {

    private static final long CLOCK_DRIFT_MARGIN_MS = 2;

    private final List<LockBackend> backends;
    private final LockSettings settings;
    private final Consumer<Throwable> errorObserver;
    private final int quorum;

    public QuorumLock(List<LockBackend> backends, LockSettings settings, Consumer<Throwable> errorObserver) {
        if (backends == null || backends.isEmpty()) {
            throw new IllegalArgumentException("at least one lock backend is required");
        }
        this.backends = List.copyOf(backends);
        this.settings = settings;
        this.errorObserver = errorObserver;
        this.quorum = this.backends.size() / 2 + 1;
    }

    public record Lease(String resource, String token, long validUntilMillis) {}

    public Lease acquire(String resource, long ttlMillis) {
        String token = UUID.randomUUID().toString();
        Throwable lastError = null;

        for (int attempt = 0; attempt <= settings.retryCount(); attempt++) {
            long start = System.currentTimeMillis();
            int votes = 0;

            for (LockBackend backend : backends) {
                try {
                    if (backend.tryAcquire(resource, token, ttlMillis)) votes++;
                } catch (RuntimeException e) {
                    lastError = e;
                    errorObserver.accept(e);
                }
            }

            long drift = Math.round(settings.driftFactor() * ttlMillis) + CLOCK_DRIFT_MARGIN_MS;
            long validity = ttlMillis - (System.currentTimeMillis() - start) - drift;
            if (votes >= quorum && validity > 0) {
                return new Lease(resource, token, start + validity);
            }

            // 일부 노드에 남은 토큰 정리
            releaseAll(resource, token);

            if (attempt < settings.retryCount()) {
                try {
                    Thread.sleep(retryWait());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new LockAcquisitionException(resource, ie);
                }
            }
        }
        throw new LockAcquisitionException(resource, lastError);
    }

    public void release(Lease lease) {
        releaseAll(lease.resource(), lease.token());
    }

    public int quorum() {
        return quorum;
    }

    public void quit() {
        for (LockBackend backend : backends) {
            try {
                backend.close();
            } catch (RuntimeException e) {
                errorObserver.accept(e);
            }
        }
    }

    private void releaseAll(String resource, String token) {
        for (LockBackend backend : backends) {
            try {
                backend.release(resource, token);
            } catch (RuntimeException e) {
                errorObserver.accept(e);
            }
        }
    }

    private long retryWait() {
        long jitter = settings.retryJitterMs() > 0
                ? ThreadLocalRandom.current().nextLong(settings.retryJitterMs() + 1)
                : 0;
        return settings.retryDelayMs() + jitter;
    }
}
