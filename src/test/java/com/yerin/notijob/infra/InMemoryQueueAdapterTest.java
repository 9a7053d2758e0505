package com.yerin.notijob.infra;

import com.yerin.notijob.domain.queue.JobOptions;
import com.yerin.notijob.domain.queue.QueuedJob;
import com.yerin.notijob.domain.step.StepType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.yerin.notijob.support.Fixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("InMemoryQueueAdapter 테스트")
class InMemoryQueueAdapterTest {

    InMemoryQueueAdapter sut = new InMemoryQueueAdapter();

    @Test
    @DisplayName("즉시 잡은 바로 claim 되고 receipt 가 붙는다")
    void claim_immediate() throws Exception {
        sut.add(queued(job("j1", step("a", StepType.EMAIL)), JobOptions.standard(0)));

        List<QueuedJob> claimed = sut.claim("c1", 10, Duration.ofMillis(100));

        assertThat(claimed).extracting(QueuedJob::id).containsExactly("j1");
        assertThat(claimed.get(0).receipt()).startsWith("c1-");
        assertThat(sut.size()).isZero();
    }

    @Test
    @DisplayName("지연 잡은 시간이 되기 전에는 나오지 않는다")
    void delayed_not_claimed_early() throws Exception {
        sut.add(queued(job("j1", step("a", StepType.EMAIL)), JobOptions.standard(500)));

        assertThat(sut.claim("c1", 10, Duration.ofMillis(50))).isEmpty();
        assertThat(sut.claim("c1", 10, Duration.ofSeconds(2))).extracting(QueuedJob::id).containsExactly("j1");
    }

    @Test
    @DisplayName("max 만큼만 claim 한다")
    void claim_respects_max() throws Exception {
        for (int i = 0; i < 5; i++) {
            sut.add(queued(job("j" + i, step("a", StepType.EMAIL)), JobOptions.standard(0)));
        }

        assertThat(sut.claim("c1", 3, Duration.ofMillis(100))).hasSize(3);
        assertThat(sut.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("retry 는 시도 횟수를 유지한 채 지연 재적재한다")
    void retry_requeues_with_delay() throws Exception {
        sut.add(queued(job("j1", step("a", StepType.EMAIL)), JobOptions.standard(0)));
        QueuedJob claimed = sut.claim("c1", 1, Duration.ofMillis(100)).get(0);

        sut.retry(claimed.withAttemptsMade(1), 100);

        assertThat(sut.claim("c1", 1, Duration.ofMillis(10))).isEmpty();
        QueuedJob again = sut.claim("c1", 1, Duration.ofSeconds(1)).get(0);
        assertThat(again.attemptsMade()).isEqualTo(1);
    }

    @Test
    @DisplayName("drain 은 대기/지연 잡을 모두 비운다")
    void drain_clears() {
        sut.add(queued(job("j1", step("a", StepType.EMAIL)), JobOptions.standard(0)));
        sut.add(queued(job("j2", step("a", StepType.EMAIL)), JobOptions.standard(60_000)));

        sut.drain();

        assertThat(sut.size()).isZero();
    }
}
