package com.yerin.notijob.support;

import com.yerin.notijob.domain.queue.BackoffStrategy;
import com.yerin.notijob.domain.queue.JobOptions;
import com.yerin.notijob.domain.queue.QueuedJob;
import com.yerin.notijob.domain.step.StepType;
import com.yerin.notijob.infra.RedisStreamsQueueAdapter;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static com.yerin.notijob.support.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {"notijob.worker.enabled=false", "notijob.queue.name=adapter-it"})
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(TestHandlersConfig.class)
@ActiveProfiles("test")
@DisplayName("Redis Streams 큐 어댑터")
class RedisStreamsQueueIT extends IntegrationTestBase {

    @Autowired RedisStreamsQueueAdapter queue;

    @BeforeEach
    void clean() {
        queue.drain();
    }

    private QueuedJob queuedJob(String id, long delayMillis) {
        JobOptions options = JobOptions.standard(delayMillis).withBackoff(BackoffStrategy.WEBHOOK_FILTER_BACKOFF, 3);
        return queued(job(id, webhookFiltered("a", StepType.PUSH, false)), options);
    }

    @Test
    @DisplayName("add → claim → ack(remove) 후 큐가 빈다")
    void add_claim_ack() throws Exception {
        queue.add(queuedJob("j1", 0));

        List<QueuedJob> claimed = queue.claim("c1", 10, Duration.ofMillis(500));

        assertThat(claimed).singleElement().satisfies(job -> {
            assertThat(job.id()).isEqualTo("j1");
            assertThat(job.receipt()).isNotBlank();
            assertThat(job.options().attempts()).isEqualTo(3);
            assertThat(job.options().backoff()).isEqualTo(BackoffStrategy.WEBHOOK_FILTER_BACKOFF);
            assertThat(job.data().shouldStopOnFail()).isFalse();
            assertThat(job.data().filters()).hasSize(1);
        });

        queue.ack(claimed.get(0), true);
        assertThat(queue.size()).isZero();
        assertThat(queue.claim("c1", 10, Duration.ofMillis(100))).isEmpty();
    }

    @Test
    @DisplayName("같은 그룹의 두 컨슈머는 한 잡을 나눠 갖지 않는다")
    void one_consumer_per_job() throws Exception {
        queue.add(queuedJob("j1", 0));

        List<QueuedJob> first = queue.claim("c1", 10, Duration.ofMillis(500));
        List<QueuedJob> second = queue.claim("c2", 10, Duration.ofMillis(100));

        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
    }

    @Test
    @DisplayName("지연 잡은 기한이 지나야 꺼낼 수 있다")
    void delayed_job_promoted_when_due() throws Exception {
        queue.add(queuedJob("j1", 500));

        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.claim("c1", 10, Duration.ofMillis(100))).isEmpty();

        // 승격은 스케줄러가 맡는다
        Awaitility.await().atMost(Duration.ofSeconds(3)).untilAsserted(() ->
                assertThat(queue.claim("c1", 10, Duration.ofMillis(100)))
                        .extracting(QueuedJob::id).containsExactly("j1"));
    }

    @Test
    @DisplayName("retry 는 시도 횟수를 실어 지연 재적재한다")
    void retry_reschedules_with_attempts() throws Exception {
        queue.add(queuedJob("j1", 0));
        QueuedJob claimed = queue.claim("c1", 10, Duration.ofMillis(500)).get(0);

        queue.retry(claimed.withAttemptsMade(1), 0);
        // 원래 레코드는 지워지고 재적재분만 남는다
        assertThat(queue.size()).isEqualTo(1);

        Awaitility.await().atMost(Duration.ofSeconds(3)).untilAsserted(() -> {
            List<QueuedJob> again = queue.claim("c1", 10, Duration.ofMillis(100));
            assertThat(again).singleElement().satisfies(job -> assertThat(job.attemptsMade()).isEqualTo(1));
        });
    }

    @Test
    @DisplayName("lease 를 넘겨 ack 되지 않은 claim 은 다른 컨슈머가 다시 꺼낸다")
    void stalled_claim_requeued() throws Exception {
        queue.add(queuedJob("j1", 0));
        assertThat(queue.claim("dead-worker", 10, Duration.ofMillis(500))).hasSize(1);

        // lease 안이면 건드리지 않는다
        assertThat(queue.requeueStalled(Duration.ofSeconds(30), 10)).isZero();

        Awaitility.await().atMost(Duration.ofSeconds(3))
                .until(() -> queue.requeueStalled(Duration.ofMillis(200), 10) == 1);

        List<QueuedJob> again = queue.claim("live-worker", 10, Duration.ofMillis(500));
        assertThat(again).extracting(QueuedJob::id).containsExactly("j1");
        assertThat(queue.size()).isEqualTo(1);

        queue.ack(again.get(0), true);
        assertThat(queue.size()).isZero();
    }
}
