package com.yerin.notijob.service;

import com.yerin.notijob.application.digest.RegularDigestFilterSteps;
import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.NotificationEntity;
import com.yerin.notijob.domain.NotijobMetrics;
import com.yerin.notijob.domain.SubscriberRef;
import com.yerin.notijob.domain.step.DigestType;
import com.yerin.notijob.domain.step.NotificationTemplate;
import com.yerin.notijob.domain.step.StepType;
import com.yerin.notijob.global.exception.AppException;
import com.yerin.notijob.global.exception.code.CommonErrorCode;
import com.yerin.notijob.lock.DistributedLockService;
import com.yerin.notijob.lock.LockBackend;
import com.yerin.notijob.lock.LockSettings;
import com.yerin.notijob.repository.JobRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.yerin.notijob.support.Fixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("TriggerWorkflowService 단위 테스트")
class TriggerWorkflowServiceTest {

    NotificationJobBuilder jobBuilder = mock(NotificationJobBuilder.class);
    JobRepository jobRepository = mock(JobRepository.class);
    WorkflowQueueService workflowQueueService = mock(WorkflowQueueService.class);
    PlatformTransactionManager txManager = mock(PlatformTransactionManager.class);
    LockBackend lockBackend = mock(LockBackend.class);
    DistributedLockService lockService = new DistributedLockService(mock(NotijobMetrics.class));

    TriggerWorkflowService sut = new TriggerWorkflowService(jobBuilder, jobRepository, workflowQueueService,
            lockService, txManager, 5_000);

    CreateNotificationJobsCommand command = CreateNotificationJobsCommand.builder()
            .identifier("welcome")
            .transactionId("tx-1")
            .environmentId(ENV)
            .organizationId(ORG)
            .build();

    private NotificationEntity notification() {
        return NotificationEntity.builder().id("n-1").templateId(TEMPLATE).build();
    }

    @Test
    @DisplayName("잡에 id 와 부모 체인을 붙여 저장하고, 커밋 뒤 첫 잡만 큐에 넣는다")
    void stores_chain_then_queues_first() {
        JobEntity first = job(null, step("a", StepType.IN_APP));
        JobEntity second = job(null, digest("d", DigestType.REGULAR));
        JobEntity third = job(null, step("c", StepType.EMAIL));
        when(jobBuilder.build(command)).thenReturn(new NotificationJobs(notification(), new ArrayList<>(List.of(first, second, third))));
        when(jobRepository.saveAll(anyList())).then(returnsFirstArg());

        TriggerWorkflowService.TriggerResult result = sut.trigger(command);

        assertThat(result.transactionId()).isEqualTo("tx-1");
        assertThat(result.notificationId()).isEqualTo("n-1");
        assertThat(result.jobs()).hasSize(3);
        assertThat(first.getId()).isNotBlank();
        assertThat(first.getParentId()).isNull();
        assertThat(second.getParentId()).isEqualTo(first.getId());
        assertThat(third.getParentId()).isEqualTo(second.getId());

        InOrder order = inOrder(jobRepository, txManager, workflowQueueService);
        order.verify(jobRepository).saveAll(anyList());
        order.verify(txManager).commit(any());
        order.verify(workflowQueueService).addToQueue(first.getId(), first, 0L, ORG);
        verify(workflowQueueService, times(1)).addToQueue(anyString(), any(), anyLong(), anyString());
    }

    @Test
    @DisplayName("첫 잡이 다이제스트면 윈도우만큼 지연해서 넣는다")
    void first_digest_delayed_by_window() {
        JobEntity first = job(null, digest("d", DigestType.REGULAR));
        when(jobBuilder.build(command)).thenReturn(new NotificationJobs(notification(), List.of(first)));
        when(jobRepository.saveAll(anyList())).then(returnsFirstArg());

        sut.trigger(command);

        verify(workflowQueueService).addToQueue(first.getId(), first, 5 * 60_000L, ORG);
    }

    @Test
    @DisplayName("만들 잡이 없으면 큐에 아무것도 넣지 않는다")
    void no_jobs() {
        when(jobBuilder.build(command)).thenReturn(new NotificationJobs(notification(), List.of()));
        when(jobRepository.saveAll(anyList())).then(returnsFirstArg());

        TriggerWorkflowService.TriggerResult result = sut.trigger(command);

        assertThat(result.jobs()).isEmpty();
        assertThat(result.notificationId()).isEqualTo("n-1");
        verifyNoInteractions(workflowQueueService);
    }

    @Test
    @DisplayName("저장 실패는 PERSISTENCE_ERROR 이고 롤백되며 큐는 건드리지 않는다")
    void store_failure_rolls_back() {
        TransactionStatus status = mock(TransactionStatus.class);
        when(txManager.getTransaction(any())).thenReturn(status);
        when(jobBuilder.build(command)).thenReturn(new NotificationJobs(notification(), List.of(job(null, step("a", StepType.EMAIL)))));
        when(jobRepository.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> sut.trigger(command))
                .isInstanceOf(AppException.class)
                .satisfies(e -> assertThat(((AppException) e).getErrorCode().getCode())
                        .isEqualTo(CommonErrorCode.PERSISTENCE_ERROR.getCode()));
        verify(txManager).rollback(status);
        verifyNoInteractions(workflowQueueService);
    }

    @Test
    @DisplayName("다이제스트 템플릿은 판정부터 잡 저장, 커밋까지 다이제스트 락을 잡고 있다")
    void digest_lock_held_until_commit() {
        when(lockBackend.name()).thenReturn("primary");
        when(lockBackend.tryAcquire(anyString(), anyString(), anyLong())).thenReturn(true);
        when(lockBackend.release(anyString(), anyString())).thenReturn(true);
        lockService.startup(List.of(lockBackend), new LockSettings(0.01, 0, 0, 0));

        String resource = RegularDigestFilterSteps.lockResource(ENV, SUBSCRIBER_REF, TEMPLATE);
        CreateNotificationJobsCommand digestCommand = CreateNotificationJobsCommand.builder()
                .identifier("welcome")
                .transactionId("tx-2")
                .environmentId(ENV)
                .organizationId(ORG)
                .template(new NotificationTemplate(TEMPLATE, "Welcome",
                        List.of(step("a", StepType.IN_APP), digest("d", DigestType.REGULAR))))
                .subscriber(new SubscriberRef(SUBSCRIBER_REF, "ext-sub-1"))
                .build();

        AtomicInteger heldWhileBuilding = new AtomicInteger(-1);
        AtomicInteger heldWhileSaving = new AtomicInteger(-1);
        AtomicInteger heldAtCommit = new AtomicInteger(-1);
        when(jobBuilder.build(digestCommand)).thenAnswer(inv -> {
            heldWhileBuilding.set(lockService.lockCount(resource));
            return new NotificationJobs(notification(), List.of(job(null, digest("d", DigestType.REGULAR))));
        });
        when(jobRepository.saveAll(anyList())).thenAnswer(inv -> {
            heldWhileSaving.set(lockService.lockCount(resource));
            return inv.getArgument(0);
        });
        doAnswer(inv -> {
            heldAtCommit.set(lockService.lockCount(resource));
            return null;
        }).when(txManager).commit(any());

        sut.trigger(digestCommand);

        assertThat(heldWhileBuilding.get()).isEqualTo(1);
        assertThat(heldWhileSaving.get()).isEqualTo(1);
        assertThat(heldAtCommit.get()).isEqualTo(1);
        assertThat(lockService.lockCount(resource)).isZero();
        verify(lockBackend).release(eq(resource), anyString());
    }

    @Test
    @DisplayName("다이제스트가 비활성이거나 없으면 락 없이 저장한다")
    void no_lock_without_active_digest() {
        lockService.startup(List.of(lockBackend), new LockSettings(0.01, 0, 0, 0));
        CreateNotificationJobsCommand plain = CreateNotificationJobsCommand.builder()
                .identifier("welcome")
                .transactionId("tx-3")
                .environmentId(ENV)
                .organizationId(ORG)
                .template(new NotificationTemplate(TEMPLATE, "Welcome",
                        List.of(step("a", StepType.EMAIL), digest("d", DigestType.REGULAR).withActive(false))))
                .subscriber(new SubscriberRef(SUBSCRIBER_REF, "ext-sub-1"))
                .build();
        when(jobBuilder.build(plain)).thenReturn(new NotificationJobs(notification(), List.of(job(null, step("a", StepType.EMAIL)))));
        when(jobRepository.saveAll(anyList())).then(returnsFirstArg());

        sut.trigger(plain);

        verify(lockBackend, never()).tryAcquire(anyString(), anyString(), anyLong());
    }
}
