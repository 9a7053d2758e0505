package com.yerin.notijob.service;

import com.yerin.notijob.application.digest.RegularDigestFilterSteps;
import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.global.exception.AppException;
import com.yerin.notijob.global.exception.code.CommonErrorCode;
import com.yerin.notijob.lock.DistributedLockService;
import com.yerin.notijob.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 트리거를 잡 체인으로 저장하고 첫 잡만 큐에 넣는다. 나머지는 앞 잡이 끝날 때 QueueNextJob 이 넣는다.
 */
@Slf4j
@Service
public class TriggerWorkflowService {

    private final NotificationJobBuilder jobBuilder;
    private final JobRepository jobRepository;
    private final WorkflowQueueService workflowQueueService;
    private final DistributedLockService lockService;
    private final TransactionTemplate tx;
    private final long digestLockTtlMillis;

    public TriggerWorkflowService(NotificationJobBuilder jobBuilder,
                                  JobRepository jobRepository,
                                  WorkflowQueueService workflowQueueService,
                                  DistributedLockService lockService,
                                  PlatformTransactionManager txManager,
                                  @Value("${notijob.digest.lock-ttl-millis:5000}") long digestLockTtlMillis) {
        this.jobBuilder = jobBuilder;
        this.jobRepository = jobRepository;
        this.workflowQueueService = workflowQueueService;
        this.lockService = lockService;
        this.tx = new TransactionTemplate(txManager);
        this.digestLockTtlMillis = digestLockTtlMillis;
    }

    public record TriggerResult(String transactionId, String notificationId, List<JobEntity> jobs) {}

    public TriggerResult trigger(CreateNotificationJobsCommand command) {
        // 커밋 뒤에 큐에 넣어야 워커가 잡을 못 찾는 일이 없다
        NotificationJobs stored = digestLockResource(command)
                .map(resource -> lockService.withLock(resource, digestLockTtlMillis, () -> buildAndStore(command)))
                .orElseGet(() -> buildAndStore(command));
        String notificationId = stored.notification().getId();

        if (stored.jobs().isEmpty()) {
            log.info("[Trigger] no jobs to run transactionId={}, notificationId={}", command.transactionId(), notificationId);
            return new TriggerResult(command.transactionId(), notificationId, List.of());
        }

        JobEntity first = stored.jobs().get(0);
        long delay = first.getStep() == null ? 0 : first.getStep().delay().toMillis();
        workflowQueueService.addToQueue(first.getId(), first, delay, command.organizationId());

        log.info("[Trigger] transactionId={}, notificationId={}, jobs={}",
                command.transactionId(), notificationId, stored.jobs().size());
        return new TriggerResult(command.transactionId(), notificationId, stored.jobs());
    }

    private NotificationJobs buildAndStore(CreateNotificationJobsCommand command) {
        return tx.execute(status -> store(jobBuilder.build(command)));
    }

    // 다이제스트 판정부터 새 다이제스트 잡 커밋까지 같은 락 안에 있어야 동시 트리거가 윈도우를 두 번 열지 않는다
    private Optional<String> digestLockResource(CreateNotificationJobsCommand command) {
        if (command.template() == null || command.subscriber() == null) return Optional.empty();
        return command.template().firstActiveDigest()
                .filter(step -> step.metadata() != null && step.metadata().type() != null)
                .map(step -> RegularDigestFilterSteps.lockResource(
                        command.environmentId(), command.subscriber().id(), command.template().id()));
    }

    private NotificationJobs store(NotificationJobs built) {
        String parentId = null;
        for (JobEntity job : built.jobs()) {
            job.setId(UUID.randomUUID().toString());
            job.setParentId(parentId);
            parentId = job.getId();
        }
        try {
            return new NotificationJobs(built.notification(), jobRepository.saveAll(built.jobs()));
        } catch (DataAccessException e) {
            throw new AppException(CommonErrorCode.PERSISTENCE_ERROR.withDetail(
                    "jobs not stored notificationId=" + built.notification().getId()), e);
        }
    }
}
