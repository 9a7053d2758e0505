package com.yerin.notijob.lock;

import com.yerin.notijob.domain.NotijobMetrics;
import com.yerin.notijob.global.exception.LockAcquisitionException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 쿼럼 락 위에서 리소스 단위 임계 구역을 제공한다.
 * <p>
 * 락 노드가 하나도 설정되지 않았으면 비활성 상태로 남고, 이때 acquire 는 즉시 no-op 핸들을 돌려준다.
 * 종료 시 {@link #drain()} 이 보유 중인 락이 모두 풀릴 때까지 기다린 뒤 노드 연결을 닫는다.
 */
@Slf4j
@Service
public class DistributedLockService {

    static final long DRAIN_POLL_MILLIS = 250;

    private final NotijobMetrics metrics;
    private final LockCounter lockCounter = new LockCounter();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final AtomicReference<LockState> state = new AtomicReference<>(LockState.UNINITIALIZED);

    private volatile QuorumLock distributedLock;

    public DistributedLockService(NotijobMetrics metrics) {
        this.metrics = metrics;
    }

    public synchronized void startup(List<LockBackend> backends, LockSettings settings) {
        if (distributedLock != null) {
            return;
        }
        if (backends == null || backends.isEmpty()) {
            log.info("[DistributedLock] no lock backend configured, running unprotected");
            return;
        }

        // 소수 노드 실패는 알고리즘이 허용하는 범위라 로그만 남긴다
        distributedLock = new QuorumLock(backends, settings,
                error -> log.error("[DistributedLock] backend error: {}", error.toString()));
        state.set(LockState.READY);
        log.info("[DistributedLock] started backends={}, quorum={}, settings={}",
                backends.stream().map(LockBackend::name).toList(), distributedLock.quorum(), settings);
    }

    public boolean isEnabled() {
        return distributedLock != null;
    }

    public LockState state() {
        return state.get();
    }

    public int lockCount(String resource) {
        return lockCounter.get(resource);
    }

    public boolean areAllLocksReleased() {
        return lockCounter.allReleased();
    }

    public LockHandle acquire(String resource, long ttlMillis) {
        QuorumLock lock = this.distributedLock;
        if (lock == null) {
            return LockHandle.noop(resource, ttlMillis);
        }

        QuorumLock.Lease lease;
        try {
            lease = lock.acquire(resource, ttlMillis);
        } catch (LockAcquisitionException e) {
            metrics.incLockFailed();
            log.warn("[DistributedLock] acquire failed resource={}, err={}", resource, e.toString());
            throw e;
        }
        lockCounter.increment(resource);
        log.debug("[DistributedLock] acquired resource={} ttl={}ms", resource, ttlMillis);
        return new CountedLockHandle(lock, lease, ttlMillis);
    }

    public <T> T withLock(String resource, long ttlMillis, Supplier<T> body) {
        LockHandle handle = acquire(resource, ttlMillis);
        try {
            return body.get();
        } finally {
            handle.release();
        }
    }

    public void withLock(String resource, long ttlMillis, Runnable body) {
        withLock(resource, ttlMillis, () -> {
            body.run();
            return null;
        });
    }

    @PreDestroy
    public void drain() {
        QuorumLock lock = this.distributedLock;
        if (lock == null) {
            state.compareAndSet(LockState.UNINITIALIZED, LockState.STOPPED);
            return;
        }
        state.compareAndSet(LockState.READY, LockState.DRAINING);

        while (!lockCounter.allReleased()) {
            try {
                Thread.sleep(DRAIN_POLL_MILLIS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("[DistributedLock] drain interrupted with locks still held, backend left open");
                return;
            }
        }

        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("[DistributedLock] all locks released, shutting down backends");
            lock.quit();
        } catch (RuntimeException e) {
            log.warn("[DistributedLock] error while quitting: {}", e.toString());
        } finally {
            distributedLock = null;
            state.set(LockState.STOPPED);
            log.info("[DistributedLock] stopped");
        }
    }

    private final class CountedLockHandle implements LockHandle {
        private final QuorumLock lock;
        private final QuorumLock.Lease lease;
        private final long ttlMillis;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private CountedLockHandle(QuorumLock lock, QuorumLock.Lease lease, long ttlMillis) {
            this.lock = lock;
            this.lease = lease;
            this.ttlMillis = ttlMillis;
        }

        @Override
        public String resource() {
            return lease.resource();
        }

        @Override
        public long ttlMillis() {
            return ttlMillis;
        }

        @Override
        public void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                lock.release(lease);
                log.debug("[DistributedLock] released resource={}", lease.resource());
            } catch (RuntimeException e) {
                log.error("[DistributedLock] release failed resource={}, err={}", lease.resource(), e.toString());
            } finally {
                lockCounter.decrement(lease.resource());
            }
        }
    }
}
