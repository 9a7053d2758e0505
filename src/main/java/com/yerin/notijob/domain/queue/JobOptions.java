package com.yerin.notijob.domain.queue;

public record JobOptions(
        long delayMillis,
        int attempts,
        BackoffStrategy backoff,
        boolean removeOnComplete,
        boolean removeOnFail
) {
    public static JobOptions standard(long delayMillis) {
        return new JobOptions(Math.max(0, delayMillis), 1, null, true, true);
    }

    public JobOptions withBackoff(BackoffStrategy strategy, int maxAttempts) {
        return new JobOptions(delayMillis, maxAttempts, strategy, removeOnComplete, removeOnFail);
    }

    public boolean hasBackoff() {
        return backoff != null;
    }
}
