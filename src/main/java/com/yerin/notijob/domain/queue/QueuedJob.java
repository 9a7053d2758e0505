package com.yerin.notijob.domain.queue;

/**
 * @param id             큐 상의 잡 이름 (JobEntity id)
 * @param attemptsMade   지금까지 실패한 실행 횟수
 * @param organizationId 우선순위 스코프
 * @param receipt        백엔드가 claim 시 부여한 식별자 (Redis 스트림 레코드 id 등). 적재 전에는 null
 */
public record QueuedJob(
        String id,
        JobData data,
        JobOptions options,
        int attemptsMade,
        String organizationId,
        String receipt
) {
    public QueuedJob withAttemptsMade(int attempts) {
        return new QueuedJob(id, data, options, attempts, organizationId, receipt);
    }

    public QueuedJob withReceipt(String value) {
        return new QueuedJob(id, data, options, attemptsMade, organizationId, value);
    }
}
