package com.yerin.notijob.application;

import com.yerin.notijob.cache.CacheKeys;
import com.yerin.notijob.cache.InvalidateCacheService;
import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.step.StepType;
import com.yerin.notijob.global.exception.AppException;
import com.yerin.notijob.global.exception.FilterBackoffException;
import com.yerin.notijob.global.exception.TerminalJobException;
import com.yerin.notijob.global.exception.code.JobErrorCode;
import com.yerin.notijob.lock.DistributedLockService;
import com.yerin.notijob.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;

/**
 * 큐에서 꺼낸 잡 하나를 실행한다. 성공/실패 이후의 상태 전이와 체이닝은 호출 측(WorkflowQueueService)이 맡는다.
 */
@Slf4j
@Service
public class RunJob {

    private final JobRepository jobRepository;
    private final StepHandlerRegistry handlers;
    private final JobStatusService jobStatusService;
    private final DistributedLockService lockService;
    private final InvalidateCacheService invalidateCache;
    private final String cachePrefix;
    private final long lockTtlMillis;

    public RunJob(JobRepository jobRepository,
                  StepHandlerRegistry handlers,
                  JobStatusService jobStatusService,
                  DistributedLockService lockService,
                  InvalidateCacheService invalidateCache,
                  @Value("${notijob.cache.key-prefix:notijob}") String cachePrefix,
                  @Value("${notijob.worker.step-lock-ttl-millis:30000}") long lockTtlMillis) {
        this.jobRepository = jobRepository;
        this.handlers = handlers;
        this.jobStatusService = jobStatusService;
        this.lockService = lockService;
        this.invalidateCache = invalidateCache;
        this.cachePrefix = cachePrefix;
        this.lockTtlMillis = lockTtlMillis;
    }

    /**
     * @return 실행했으면 true, 잡이 이미 종료 상태여서 건너뛰었으면 false
     */
    public boolean execute(RunJobCommand command) {
        JobEntity job = jobRepository.findByIdAndEnvironmentId(command.jobId(), command.environmentId())
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND.withDetail(
                        "Job " + command.jobId() + " not found in environment " + command.environmentId())));

        ChannelStepHandler handler = handlers.get(job.getType())
                .orElseThrow(() -> new TerminalJobException(JobErrorCode.STEP_HANDLER_NOT_FOUND.withDetail(
                        "No step handler for type=" + job.getType())));

        Optional<String> resource = handler.lockResource(job);
        boolean executed = resource
                .map(r -> lockService.withLock(r, lockTtlMillis, () -> run(job, handler, command.attempt())))
                .orElseGet(() -> run(job, handler, command.attempt()));

        if (executed && job.getType() == StepType.IN_APP) {
            invalidateFeed(job);
        }
        return executed;
    }

    /**
     * 원인 체인 어디에든 {@link FilterBackoffException} 이 있으면 백오프 재시도 대상이다.
     */
    public boolean shouldBackoff(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = error; t != null && seen.add(t); t = t.getCause()) {
            if (t instanceof FilterBackoffException) return true;
        }
        return false;
    }

    private boolean run(JobEntity job, ChannelStepHandler handler, int attempt) {
        if (!jobStatusService.setRunning(job.getId(), job.getEnvironmentId(), attempt)) {
            log.info("[RunJob] skip finished job jobId={}, status={}", job.getId(), job.getStatus());
            return false;
        }
        handler.handle(job);
        return true;
    }

    private void invalidateFeed(JobEntity job) {
        invalidateCache.invalidateQuery(CacheKeys.queryScope(
                cachePrefix, CacheKeys.FEED, job.getEnvironmentId(), job.getSubscriberId()));
        invalidateCache.invalidateQuery(CacheKeys.queryScope(
                cachePrefix, CacheKeys.MESSAGE_COUNT, job.getEnvironmentId(), job.getSubscriberId()));
    }
}
