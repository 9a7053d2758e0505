package com.yerin.notijob.infra;

import com.yerin.notijob.domain.JobQueuePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * lease 시간 넘게 ack 되지 않은 claim 을 큐로 되돌린다.
 * 워커가 죽으면 그 컨슈머의 PEL 항목은 아무도 다시 읽지 않으므로 주기적으로 회수한다.
 */
@Slf4j
@Component
public class StalledJobReaper {

    private final JobQueuePort queue;
    private final Duration lease;
    private final int batch;

    public StalledJobReaper(JobQueuePort queue,
                            @Value("${notijob.queue.lease-millis:90000}") long leaseMillis,
                            @Value("${notijob.queue.reap-batch:100}") int batch) {
        this.queue = queue;
        this.lease = Duration.ofMillis(leaseMillis);
        this.batch = batch;
    }

    @Scheduled(fixedDelayString = "${notijob.queue.reap-interval-millis:5000}")
    public int reap() {
        int requeued;
        try {
            requeued = queue.requeueStalled(lease, batch);
        } catch (RuntimeException e) {
            log.warn("[StalledJobReaper] reap failed, err={}", e.toString());
            return 0;
        }
        if (requeued > 0) {
            log.info("[StalledJobReaper] requeued={} (idle > {}ms)", requeued, lease.toMillis());
        }
        return requeued;
    }
}
