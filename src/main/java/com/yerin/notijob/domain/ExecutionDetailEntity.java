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
@Table(name = "execution_detail")
public class ExecutionDetailEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 36)
    private String jobId;

    @Column(name = "notification_id", length = 36)
    private String notificationId;

    @Column(name = "environment_id", nullable = false, length = 64)
    private String environmentId;

    @Column(name = "organization_id", nullable = false, length = 64)
    private String organizationId;

    @Column(name = "subscriber_ref_id", length = 64)
    private String subscriberRefId;

    @Column(name = "transaction_id", length = 100)
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 60)
    private ExecutionDetail detail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ExecutionDetailSource source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ExecutionDetailStatus status;

    @Column(name = "is_test", nullable = false)
    private boolean isTest;

    @Column(name = "is_retry", nullable = false)
    private boolean isRetry;

    @Column(columnDefinition = "text")
    private String raw;

    @Column(name = "ts", nullable = false)
    private Instant ts;

    @PrePersist void pre() { if (ts == null) ts = Instant.now(); }
}
