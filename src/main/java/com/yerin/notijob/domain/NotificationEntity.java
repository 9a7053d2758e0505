package com.yerin.notijob.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "notification", indexes = {
        @Index(name = "ix_notification_subscriber_template", columnList = "environment_id,subscriber_ref_id,template_id,created_at")
})
public class NotificationEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "environment_id", nullable = false, length = 64)
    private String environmentId;

    @Column(name = "organization_id", nullable = false, length = 64)
    private String organizationId;

    @Column(name = "subscriber_ref_id", nullable = false, length = 64)
    private String subscriberRefId;

    @Column(name = "template_id", nullable = false, length = 64)
    private String templateId;

    @Column(name = "transaction_id", nullable = false, length = 100)
    private String transactionId;

    @Column(name = "to_json", columnDefinition = "text")
    private String toJson;

    @Column(name = "payload_json", columnDefinition = "text")
    private String payloadJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
