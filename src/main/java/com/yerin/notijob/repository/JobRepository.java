package com.yerin.notijob.repository;

import com.yerin.notijob.domain.JobEntity;
import com.yerin.notijob.domain.JobStatus;
import com.yerin.notijob.domain.step.StepType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface JobRepository extends JpaRepository<JobEntity, String> {

    Optional<JobEntity> findByIdAndEnvironmentId(String id, String environmentId);

    Optional<JobEntity> findFirstByEnvironmentIdAndParentId(String environmentId, String parentId);

    List<JobEntity> findByNotificationIdOrderByCreatedAtAsc(String notificationId);

    boolean existsByEnvironmentIdAndSubscriberRefIdAndTemplateIdAndTypeAndStatus(
            String environmentId, String subscriberRefId, String templateId, StepType type, JobStatus status);

    long countByStatus(JobStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update JobEntity j
          set j.status = com.yerin.notijob.domain.JobStatus.RUNNING,
              j.attempts = :attempts
        where j.id = :id
          and j.environmentId = :environmentId
          and j.status in (com.yerin.notijob.domain.JobStatus.PENDING, com.yerin.notijob.domain.JobStatus.RUNNING)
       """)
    int markRunning(@Param("id") String id,
                    @Param("environmentId") String environmentId,
                    @Param("attempts") int attempts);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update JobEntity j
          set j.status = com.yerin.notijob.domain.JobStatus.PENDING,
              j.attempts = :attempts
        where j.id = :id
          and j.environmentId = :environmentId
          and j.status <> com.yerin.notijob.domain.JobStatus.COMPLETED
       """)
    int markPendingForRetry(@Param("id") String id,
                            @Param("environmentId") String environmentId,
                            @Param("attempts") int attempts);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update JobEntity j
          set j.status = com.yerin.notijob.domain.JobStatus.COMPLETED,
              j.error = null
        where j.id = :id
          and j.environmentId = :environmentId
          and j.status <> com.yerin.notijob.domain.JobStatus.COMPLETED
       """)
    int completeIfNotCompleted(@Param("id") String id,
                               @Param("environmentId") String environmentId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update JobEntity j
          set j.status = com.yerin.notijob.domain.JobStatus.FAILED,
              j.error = :error
        where j.id = :id
          and j.environmentId = :environmentId
          and j.status <> com.yerin.notijob.domain.JobStatus.COMPLETED
       """)
    int failIfNotCompleted(@Param("id") String id,
                           @Param("environmentId") String environmentId,
                           @Param("error") String error);
}
