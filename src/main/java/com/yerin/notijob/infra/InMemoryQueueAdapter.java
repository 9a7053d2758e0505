package com.yerin.notijob.infra;

import com.yerin.notijob.domain.JobQueuePort;
import com.yerin.notijob.domain.queue.QueuedJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
@Profile("local-inmem") // Redis 없이 단일 프로세스로 띄울 때
public class InMemoryQueueAdapter implements JobQueuePort {

    private final DelayQueue<Entry> queue = new DelayQueue<>();
    private final AtomicLong sequence = new AtomicLong();

    private record Entry(QueuedJob job, long dueAtMillis, long seq) implements Delayed {
        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueAtMillis - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed o) {
            Entry other = (Entry) o;
            int byDue = Long.compare(dueAtMillis, other.dueAtMillis);
            return byDue != 0 ? byDue : Long.compare(seq, other.seq);
        }
    }

    @Override
    public void add(QueuedJob job) {
        long delay = job.options() == null ? 0 : job.options().delayMillis();
        offer(job, delay);
        log.info("[InMemoryQueue] add jobId={}, delay={}ms", job.id(), delay);
    }

    @Override
    public List<QueuedJob> claim(String consumer, int max, Duration block) throws InterruptedException {
        Entry first = queue.poll(block.toMillis(), TimeUnit.MILLISECONDS);
        if (first == null) return List.of();

        List<Entry> entries = new ArrayList<>();
        entries.add(first);
        if (max > 1) queue.drainTo(entries, max - 1);

        List<QueuedJob> claimed = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            claimed.add(e.job().withReceipt(consumer + "-" + e.seq()));
        }
        return claimed;
    }

    @Override
    public void ack(QueuedJob job, boolean remove) {
        // claim 시점에 이미 큐에서 빠졌다
    }

    @Override
    public void retry(QueuedJob job, long delayMillis) {
        offer(job.withReceipt(null), Math.max(0, delayMillis));
        log.info("[InMemoryQueue] retry jobId={}, attemptsMade={}, delay={}ms", job.id(), job.attemptsMade(), delayMillis);
    }

    @Override
    public int requeueStalled(Duration minIdle, int max) {
        // claim 과 실행이 같은 프로세스라 프로세스가 죽으면 큐도 함께 사라진다
        return 0;
    }

    @Override
    public long size() {
        return queue.size();
    }

    @Override
    public void drain() {
        queue.clear();
    }

    private void offer(QueuedJob job, long delayMillis) {
        queue.offer(new Entry(job, System.currentTimeMillis() + delayMillis, sequence.incrementAndGet()));
    }
}
