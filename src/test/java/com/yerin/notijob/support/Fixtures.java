package com.yerin.notijob.support;

import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.JobStatus;
import com.yerin.notijob.domain.queue.JobData;
import com.yerin.notijob.domain.queue.JobOptions;
import com.yerin.notijob.domain.queue.QueuedJob;
import com.yerin.notijob.domain.step.DigestMetadata;
import com.yerin.notijob.domain.step.DigestType;
import com.yerin.notijob.domain.step.DigestUnit;
import com.yerin.notijob.domain.step.FilterChild;
import com.yerin.notijob.domain.step.FilterOn;
import com.yerin.notijob.domain.step.MessageTemplate;
import com.yerin.notijob.domain.step.NotificationStep;
import com.yerin.notijob.domain.step.StepFilter;
import com.yerin.notijob.domain.step.StepType;

import java.util.List;

/** 테스트용 스텝/잡 생성 헬퍼. */
public final class Fixtures {

    public static final String ENV = "env-1";
    public static final String ORG = "org-1";
    public static final String SUBSCRIBER_REF = "sub-ref-1";
    public static final String TEMPLATE = "tpl-1";

    private Fixtures() {}

    public static NotificationStep step(String id, StepType type) {
        return new NotificationStep(id, true, false, new MessageTemplate("mt-" + id, type, "hello"), List.of(), null);
    }

    public static NotificationStep inactive(String id, StepType type) {
        return step(id, type).withActive(false);
    }

    public static NotificationStep digest(String id, DigestType digestType) {
        DigestMetadata metadata = new DigestMetadata(digestType, 5, DigestUnit.MINUTES, null, 1L, DigestUnit.MINUTES);
        return new NotificationStep(id, true, false, new MessageTemplate("mt-" + id, StepType.DIGEST, ""), List.of(), metadata);
    }

    public static NotificationStep webhookFiltered(String id, StepType type, boolean stopOnFail) {
        StepFilter filter = new StepFilter(false, "BOOLEAN", "AND",
                List.of(new FilterChild("isOnline", "true", "EQUAL", FilterOn.WEBHOOK)));
        return new NotificationStep(id, true, stopOnFail, new MessageTemplate("mt-" + id, type, "hi"), List.of(filter), null);
    }

    public static JobEntity job(String id, NotificationStep step) {
        return JobEntity.builder()
                .id(id)
                .notificationId("n-1")
                .environmentId(ENV)
                .organizationId(ORG)
                .userId("u-1")
                .subscriberId("ext-sub-1")
                .subscriberRefId(SUBSCRIBER_REF)
                .templateId(TEMPLATE)
                .identifier("welcome")
                .transactionId("tx-1")
                .step(step)
                .type(step.type())
                .status(JobStatus.PENDING)
                .build();
    }

    public static QueuedJob queued(JobEntity job, JobOptions options) {
        return new QueuedJob(job.getId(), JobData.from(job), options, 0, job.getOrganizationId(), null);
    }
}
