package com.yerin.notijob.lock;

import com.yerin.notijob.global.exception.LockAcquisitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("쿼럼 락 테스트")
class QuorumLockTest {

    private static final LockSettings FAST = new LockSettings(0.01, 2, 0, 0);

    private final InMemoryLockBackend a = new InMemoryLockBackend("a");
    private final InMemoryLockBackend b = new InMemoryLockBackend("b");
    private final InMemoryLockBackend c = new InMemoryLockBackend("c");
    private final List<Throwable> observed = new ArrayList<>();

    private QuorumLock lock() {
        return new QuorumLock(List.of(a, b, c), FAST, observed::add);
    }

    @Test
    @DisplayName("노드 3개면 쿼럼은 2")
    void quorum_is_majority() {
        assertThat(lock().quorum()).isEqualTo(2);
        assertThat(new QuorumLock(List.of(a), FAST, observed::add).quorum()).isEqualTo(1);
    }

    @Test
    @DisplayName("소수 노드 장애는 획득을 막지 않고 관찰자에게만 전달된다")
    void minority_failure_tolerated() {
        c.down = true;

        QuorumLock.Lease lease = lock().acquire("res", 10_000);

        assertThat(lease.resource()).isEqualTo("res");
        assertThat(a.holder("res")).isEqualTo(lease.token());
        assertThat(b.holder("res")).isEqualTo(lease.token());
        assertThat(observed).isNotEmpty();
    }

    @Test
    @DisplayName("과반 장애면 재시도 후 LockAcquisitionException")
    void majority_failure_throws() {
        b.down = true;
        c.down = true;

        assertThatThrownBy(() -> lock().acquire("res", 10_000))
                .isInstanceOf(LockAcquisitionException.class)
                .satisfies(e -> assertThat(((LockAcquisitionException) e).getResource()).isEqualTo("res"))
                .hasCauseInstanceOf(RuntimeException.class);
        // 실패한 라운드의 토큰은 정리된다
        assertThat(a.holder("res")).isNull();
    }

    @Test
    @DisplayName("다른 토큰이 보유 중이면 획득 실패, 해제 후에는 성공")
    void contention_then_release() {
        QuorumLock lock = lock();
        QuorumLock.Lease first = lock.acquire("res", 10_000);

        assertThatThrownBy(() -> lock.acquire("res", 10_000)).isInstanceOf(LockAcquisitionException.class);

        lock.release(first);
        QuorumLock.Lease second = lock.acquire("res", 10_000);
        assertThat(second.token()).isNotEqualTo(first.token());
    }

    @Test
    @DisplayName("유효 시간은 TTL 에서 drift 를 뺀 값보다 길지 않다")
    void validity_accounts_for_drift() {
        long before = System.currentTimeMillis();
        QuorumLock.Lease lease = lock().acquire("res", 1_000);

        // drift = 1000 * 0.01 + 2
        assertThat(lease.validUntilMillis()).isLessThanOrEqualTo(before + 1_000 - 12 + 50);
        assertThat(lease.validUntilMillis()).isGreaterThan(before);
    }

    @Test
    @DisplayName("quit 은 모든 노드를 닫는다")
    void quit_closes_all() {
        lock().quit();

        assertThat(a.closeCalls.get() + b.closeCalls.get() + c.closeCalls.get()).isEqualTo(3);
    }
}
