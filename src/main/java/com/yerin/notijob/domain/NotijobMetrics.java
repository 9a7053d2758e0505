package com.yerin.notijob.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class NotijobMetrics {

    private final MeterRegistry registry;

    private final Counter jobQueued;
    private final Counter jobCompleted;
    private final Counter jobFailed;
    private final Counter jobRetried;
    private final Counter lockFailed;

    public NotijobMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobQueued    = Counter.builder("notijob_jobs_queued_total")
                .description("jobs added to the workflow queue").register(registry);
        this.jobCompleted = Counter.builder("notijob_jobs_completed_total")
                .description("jobs completed").register(registry);
        this.jobFailed    = Counter.builder("notijob_jobs_failed_total")
                .description("jobs marked FAILED").register(registry);
        this.jobRetried   = Counter.builder("notijob_jobs_retried_total")
                .description("jobs scheduled for backoff retry").register(registry);
        this.lockFailed   = Counter.builder("notijob_lock_acquire_failed_total")
                .description("quorum lock acquisitions that ran out of retries").register(registry);
    }

    public void incQueued()     { jobQueued.increment(); }
    public void incCompleted()  { jobCompleted.increment(); }
    public void incFailed()     { jobFailed.increment(); }
    public void incRetried()    { jobRetried.increment(); }
    public void incLockFailed() { lockFailed.increment(); }

    // 스텝 타입 태그가 붙은 실행 타이머
    public Timer handlerTimer(String stepType) {
        return Timer.builder("notijob_step_duration_seconds")
                .description("step execution duration by step type")
                .tag("type", stepType)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
