package com.yerin.notijob.service;

import com.yerin.notijob.application.ExecutionDetailsService;
import com.yerin.notijob.application.JobStatusService;
import com.yerin.notijob.application.QueueNextJob;
import com.yerin.notijob.application.RunJob;
import com.yerin.notijob.application.RunJobCommand;
import com.yerin.notijob.domain.ExecutionDetail;
import com.yerin.notijob.domain.ExecutionDetailSource;
import com.yerin.notijob.domain.ExecutionDetailStatus;
import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.JobQueuePort;
import com.yerin.notijob.domain.NotijobMetrics;
import com.yerin.notijob.domain.queue.BackoffStrategy;
import com.yerin.notijob.domain.queue.JobData;
import com.yerin.notijob.domain.queue.JobOptions;
import com.yerin.notijob.domain.queue.QueuedJob;
import com.yerin.notijob.domain.step.FilterOn;
import com.yerin.notijob.global.exception.AppException;
import com.yerin.notijob.global.exception.FilterBackoffException;
import com.yerin.notijob.global.exception.code.JobErrorCode;
import com.yerin.notijob.infra.backoff.BackoffRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * 워크플로 큐의 생산자이자 잡 한 건의 실행/완료/실패 처리기.
 * <p>
 * 실패 처리:
 * <ul>
 *   <li>백오프 대상이고 시도가 남았으면 PENDING 으로 되돌리고 백오프 지연 뒤 재적재</li>
 *   <li>백오프 대상이 아니면 FAILED + STEP_FAILED 기록 후 (stopOnFail 이 아니면) 다음 잡</li>
 *   <li>백오프 대상인데 마지막 시도였으면 FAILED + WEBHOOK_FILTER_FAILED_LAST_RETRY 기록 후 (stopOnFail 이 아니면) 다음 잡</li>
 * </ul>
 */
@Slf4j
@Service
public class WorkflowQueueService {

    public static final int DEFAULT_ATTEMPTS = 3;
    static final String TEST_ENV = "test";

    private final JobQueuePort queue;
    private final RunJob runJob;
    private final JobStatusService jobStatusService;
    private final QueueNextJob queueNextJob;
    private final ExecutionDetailsService executionDetails;
    private final BackoffRegistry backoffRegistry;
    private final NotijobMetrics metrics;
    private final String env;

    public WorkflowQueueService(JobQueuePort queue,
                                RunJob runJob,
                                JobStatusService jobStatusService,
                                QueueNextJob queueNextJob,
                                ExecutionDetailsService executionDetails,
                                BackoffRegistry backoffRegistry,
                                NotijobMetrics metrics,
                                @Value("${notijob.env:local}") String env) {
        this.queue = queue;
        this.runJob = runJob;
        this.jobStatusService = jobStatusService;
        this.queueNextJob = queueNextJob;
        this.executionDetails = executionDetails;
        this.backoffRegistry = backoffRegistry;
        this.metrics = metrics;
        this.env = env;
    }

    public void addToQueue(String id, JobEntity job, Long delayMillis, String organizationId) {
        JobOptions options = JobOptions.standard(delayMillis == null ? 0 : delayMillis);
        if (job.getStep() != null && job.getStep().containsFilterOn(FilterOn.WEBHOOK)) {
            options = options.withBackoff(BackoffStrategy.WEBHOOK_FILTER_BACKOFF, DEFAULT_ATTEMPTS);
        }

        queue.add(new QueuedJob(id, JobData.from(job), options, 0, organizationId, null));
        metrics.incQueued();
        log.info("[WorkflowQueue] queued jobId={}, type={}, delay={}ms, attempts={}",
                id, job.getType(), options.delayMillis(), options.attempts());
    }

    /**
     * 워커 스레드에서 호출된다. 큐 처리 결과(ack/재적재)까지 여기서 끝낸다.
     */
    public void handle(QueuedJob job) {
        JobData data = job.data();
        MDC.put("jobId", job.id());
        MDC.put("transactionId", data.transactionId());
        long start = System.nanoTime();
        try {
            boolean executed;
            try {
                executed = runJob.execute(RunJobCommand.from(data, job.attemptsMade() + 1));
            } catch (RuntimeException e) {
                onFailed(job, e);
                return;
            }
            onCompleted(job, executed);
        } finally {
            metrics.handlerTimer(String.valueOf(data.type())).record(Duration.ofNanos(System.nanoTime() - start));
            MDC.remove("jobId");
            MDC.remove("transactionId");
        }
    }

    /** 큐를 비운다. notijob.env=test 에서만 허용된다. */
    public void purgeForTests() {
        if (!TEST_ENV.equals(env)) {
            throw new AppException(JobErrorCode.TEST_ONLY_OPERATION);
        }
        queue.drain();
        log.info("[WorkflowQueue] purged queue for tests");
    }

    private void onCompleted(QueuedJob job, boolean executed) {
        JobData data = job.data();
        queue.ack(job, job.options().removeOnComplete());
        if (!executed) return;

        jobStatusService.setCompleted(data.jobId(), data.environmentId());
        metrics.incCompleted();
        log.info("[WorkflowQueue] completed jobId={}", data.jobId());

        queueNextJob.execute(data);
    }

    private void onFailed(QueuedJob job, RuntimeException error) {
        JobData data = job.data();
        JobOptions options = job.options();
        int attemptsMade = job.attemptsMade() + 1;
        boolean hasToBackoff = runJob.shouldBackoff(error);
        boolean attemptsLeft = attemptsMade < Math.max(1, options.attempts());

        if (hasToBackoff && attemptsLeft && options.hasBackoff() && scheduleRetry(job, attemptsMade, error)) {
            return;
        }

        queue.ack(job, options.removeOnFail());
        jobStatusService.setFailed(data.jobId(), data.environmentId(), errorText(error));
        metrics.incFailed();

        if (hasToBackoff) {
            log.warn("[WorkflowQueue] last webhook filter retry failed jobId={}, attempts={}", data.jobId(), attemptsMade);
            executionDetails.create(data, ExecutionDetail.WEBHOOK_FILTER_FAILED_LAST_RETRY,
                    ExecutionDetailSource.WEBHOOK, ExecutionDetailStatus.PENDING, true, backoffMessage(error));
        } else {
            log.warn("[WorkflowQueue] job failed jobId={}, err={}", data.jobId(), error.toString());
            executionDetails.create(data, ExecutionDetail.STEP_FAILED,
                    ExecutionDetailSource.INTERNAL, ExecutionDetailStatus.FAILED, false, errorText(error));
        }

        if (!data.shouldStopOnFail()) {
            queueNextJob.execute(data);
        }
    }

    // 재적재를 못 하면 PENDING 으로 남은 잡을 아무도 꺼내지 않으므로 false 를 돌려 실패 처리로 넘긴다
    private boolean scheduleRetry(QueuedJob job, int attemptsMade, RuntimeException error) {
        JobData data = job.data();
        JobOptions options = job.options();
        long delay = backoffRegistry.delay(options.backoff(), attemptsMade, error, job);
        jobStatusService.setPending(data.jobId(), data.environmentId(), attemptsMade);
        try {
            queue.retry(job.withAttemptsMade(attemptsMade), delay);
        } catch (RuntimeException e) {
            log.error("[WorkflowQueue] retry not scheduled jobId={}, attempt={}, err={}",
                    data.jobId(), attemptsMade, e.toString());
            return false;
        }
        metrics.incRetried();
        log.info("[WorkflowQueue] backoff retry jobId={}, attempt={}/{}, after {} ms",
                data.jobId(), attemptsMade, options.attempts(), delay);
        return true;
    }

    private static String errorText(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.toString();
    }

    private static String backoffMessage(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof FilterBackoffException) return t.getMessage();
            if (t.getCause() == t) break;
        }
        return errorText(error);
    }
}
