package com.yerin.notijob.application;

import com.yerin.notijob.domain.queue.JobData;

/**
 * @param attempt 이번 실행 차수 (1부터)
 */
public record RunJobCommand(
        String jobId,
        String environmentId,
        String organizationId,
        String userId,
        int attempt
) {
    public static RunJobCommand from(JobData data, int attempt) {
        return new RunJobCommand(data.jobId(), data.environmentId(), data.organizationId(), data.userId(), attempt);
    }
}
