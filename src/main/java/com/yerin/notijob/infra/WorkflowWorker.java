package com.yerin.notijob.infra;

import com.yerin.notijob.domain.JobQueuePort;
import com.yerin.notijob.domain.queue.QueuedJob;
import com.yerin.notijob.service.WorkflowQueueService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 큐 폴링 루프. 세마포어 허가 수만큼만 claim 하므로 동시에 실행되는 잡은 concurrency 를 넘지 않는다.
 * 종료 시 폴링을 멈추고 실행 중인 잡이 끝날 때까지 기다린다. 락 서비스보다 먼저 내려간다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "notijob.worker.enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowWorker {

    private final JobQueuePort queue;
    private final WorkflowQueueService workflowQueueService;
    private final int concurrency;
    private final int batchSize;
    private final long blockMillis;
    private final long shutdownTimeoutSeconds;

    private final String consumer = WorkerId.consumerName();
    private final Semaphore permits;
    private final ExecutorService workers;

    private volatile boolean running = false;
    private Thread poller;

    public WorkflowWorker(JobQueuePort queue,
                          WorkflowQueueService workflowQueueService,
                          @Value("${notijob.worker.concurrency:200}") int concurrency,
                          @Value("${notijob.worker.batch-size:10}") int batchSize,
                          @Value("${notijob.worker.block-millis:2000}") long blockMillis,
                          @Value("${notijob.worker.shutdown-timeout-seconds:30}") long shutdownTimeoutSeconds) {
        this.queue = queue;
        this.workflowQueueService = workflowQueueService;
        this.concurrency = concurrency;
        this.batchSize = Math.max(1, batchSize);
        this.blockMillis = blockMillis;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        this.permits = new Semaphore(concurrency);
        this.workers = Executors.newFixedThreadPool(concurrency);
    }

    @PostConstruct
    public void start() {
        running = true;
        poller = new Thread(this::pollLoop, "notijob-poller");
        poller.start();
        log.info("[Worker] started consumer={}, concurrency={}, batchSize={}", consumer, concurrency, batchSize);
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (poller != null) {
            poller.interrupt();
            try {
                poller.join(TimeUnit.SECONDS.toMillis(shutdownTimeoutSeconds));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("[Worker] in-flight jobs did not finish in {}s, interrupting", shutdownTimeoutSeconds);
                workers.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("[Worker] stopped consumer={}", consumer);
    }

    /**
     * 빈 허가 수와 batchSize 중 작은 만큼 claim 해서 풀에 넘긴다.
     *
     * @return 넘긴 잡 수
     */
    public int pollOnce() throws InterruptedException {
        if (!permits.tryAcquire(blockMillis, TimeUnit.MILLISECONDS)) return 0;

        int extra = Math.min(permits.availablePermits(), batchSize - 1);
        int reserved = 1 + (extra > 0 && permits.tryAcquire(extra) ? extra : 0);

        List<QueuedJob> jobs;
        try {
            jobs = queue.claim(consumer, reserved, Duration.ofMillis(blockMillis));
        } catch (InterruptedException | RuntimeException e) {
            permits.release(reserved);
            throw e;
        }
        if (jobs.size() < reserved) {
            permits.release(reserved - jobs.size());
        }

        for (QueuedJob job : jobs) {
            submit(job);
        }
        return jobs.size();
    }

    public int inFlight() {
        return concurrency - permits.availablePermits();
    }

    private void pollLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.warn("[Worker] poll loop error: {}", e.toString());
                try {
                    Thread.sleep(100);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    private void submit(QueuedJob job) {
        try {
            workers.execute(() -> {
                try {
                    workflowQueueService.handle(job);
                } catch (RuntimeException e) {
                    log.error("[Worker] job handling error jobId={}, err={}", job.id(), e.toString());
                } finally {
                    permits.release();
                }
            });
        } catch (RejectedExecutionException e) {
            permits.release();
            log.warn("[Worker] rejected after shutdown jobId={}, left unacknowledged", job.id());
        }
    }
}
