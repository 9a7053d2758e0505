package com.yerin.notijob.domain.queue;

import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.step.StepFilter;
import com.yerin.notijob.domain.step.StepType;

import java.util.List;

/**
 * 큐에 실리는 잡 스냅샷. 실행 시에는 jobId 로 저장소에서 최신 상태를 다시 읽는다.
 */
public record JobData(
        String jobId,
        String notificationId,
        String environmentId,
        String organizationId,
        String userId,
        String subscriberRefId,
        String transactionId,
        StepType type,
        boolean shouldStopOnFail,
        List<StepFilter> filters
) {
    public static JobData from(JobEntity job) {
        return new JobData(
                job.getId(),
                job.getNotificationId(),
                job.getEnvironmentId(),
                job.getOrganizationId(),
                job.getUserId(),
                job.getSubscriberRefId(),
                job.getTransactionId(),
                job.getType(),
                job.shouldStopOnFail(),
                job.getStep() == null || job.getStep().filters() == null ? List.of() : job.getStep().filters()
        );
    }
}
