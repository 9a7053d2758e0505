package com.yerin.notijob.application;

import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.queue.JobData;
import com.yerin.notijob.repository.JobRepository;
import com.yerin.notijob.service.WorkflowQueueService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 부모 잡이 끝난 뒤 체인의 다음 잡을 스텝 지연만큼 늦춰 큐에 넣는다.
 */
@Slf4j
@Service
public class QueueNextJob {

    private final JobRepository jobRepository;
    private final WorkflowQueueService workflowQueueService;

    // WorkflowQueueService 도 이 빈을 쓰므로 지연 주입
    public QueueNextJob(JobRepository jobRepository, @Lazy WorkflowQueueService workflowQueueService) {
        this.jobRepository = jobRepository;
        this.workflowQueueService = workflowQueueService;
    }

    public Optional<JobEntity> execute(JobData parent) {
        Optional<JobEntity> next = jobRepository.findFirstByEnvironmentIdAndParentId(parent.environmentId(), parent.jobId());
        if (next.isEmpty()) {
            log.debug("[QueueNextJob] chain finished parentId={}", parent.jobId());
            return next;
        }

        JobEntity job = next.get();
        long delay = job.getStep() == null ? 0 : job.getStep().delay().toMillis();
        workflowQueueService.addToQueue(job.getId(), job, delay, parent.organizationId());
        log.info("[QueueNextJob] queued jobId={}, parentId={}, delay={}ms", job.getId(), parent.jobId(), delay);
        return next;
    }
}
