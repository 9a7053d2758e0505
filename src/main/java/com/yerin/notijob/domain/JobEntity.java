package com.yerin.notijob.domain;

import com.yerin.notijob.domain.converter.NotificationStepConverter;
import com.yerin.notijob.domain.step.DigestMetadata;
import com.yerin.notijob.domain.step.NotificationStep;
import com.yerin.notijob.domain.step.StepType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "job", indexes = {
        @Index(name = "ix_job_parent", columnList = "environment_id,parent_id"),
        @Index(name = "ix_job_digest", columnList = "environment_id,subscriber_ref_id,template_id,type,status")
})
@DynamicUpdate
public class JobEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "notification_id", nullable = false, length = 36)
    private String notificationId;

    @Column(name = "parent_id", length = 36)
    private String parentId;

    @Column(name = "environment_id", nullable = false, length = 64)
    private String environmentId;

    @Column(name = "organization_id", nullable = false, length = 64)
    private String organizationId;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "subscriber_id", nullable = false, length = 100)
    private String subscriberId;

    @Column(name = "subscriber_ref_id", nullable = false, length = 64)
    private String subscriberRefId;

    @Column(name = "template_id", length = 64)
    private String templateId;

    @Column(nullable = false, length = 100)
    private String identifier;

    @Column(name = "transaction_id", nullable = false, length = 100)
    private String transactionId;

    @Column(name = "actor_id", length = 64)
    private String actorId;

    @Convert(converter = NotificationStepConverter.class)
    @Column(name = "step_json", nullable = false, columnDefinition = "text")
    private NotificationStep step;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private StepType type;

    @Column(name = "provider_id", length = 100)
    private String providerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private JobStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(columnDefinition = "text")
    private String error;

    @Column(name = "payload_json", columnDefinition = "text")
    private String payloadJson;

    @Column(name = "overrides_json", columnDefinition = "text")
    private String overridesJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public DigestMetadata getDigest() {
        return step == null ? null : step.metadata();
    }

    public boolean shouldStopOnFail() {
        return step != null && step.shouldStopOnFail();
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (status == null) status = JobStatus.PENDING;
    }

    @PreUpdate
    void preUpdate() { updatedAt = Instant.now(); }
}
