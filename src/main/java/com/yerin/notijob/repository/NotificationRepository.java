package com.yerin.notijob.repository;

import com.yerin.notijob.domain.NotificationEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;

public interface NotificationRepository extends JpaRepository<NotificationEntity, String> {

    boolean existsByEnvironmentIdAndSubscriberRefIdAndTemplateIdAndCreatedAtAfterAndIdNot(
            String environmentId, String subscriberRefId, String templateId, Instant createdAfter, String excludeId);
}
