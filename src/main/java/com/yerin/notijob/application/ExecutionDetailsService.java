package com.yerin.notijob.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.notijob.domain.ExecutionDetail;
import com.yerin.notijob.domain.ExecutionDetailEntity;
import com.yerin.notijob.domain.ExecutionDetailSource;
import com.yerin.notijob.domain.ExecutionDetailStatus;
import com.yerin.notijob.domain.queue.JobData;
import com.yerin.notijob.global.exception.AppException;
import com.yerin.notijob.global.exception.code.CommonErrorCode;
import com.yerin.notijob.repository.ExecutionDetailRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionDetailsService {

    private final ExecutionDetailRepository repository;
    private final ObjectMapper objectMapper;

    public ExecutionDetailEntity create(JobData job,
                                        ExecutionDetail detail,
                                        ExecutionDetailSource source,
                                        ExecutionDetailStatus status,
                                        boolean isRetry,
                                        String message) {
        ExecutionDetailEntity entity = ExecutionDetailEntity.builder()
                .jobId(job.jobId())
                .notificationId(job.notificationId())
                .environmentId(job.environmentId())
                .organizationId(job.organizationId())
                .subscriberRefId(job.subscriberRefId())
                .transactionId(job.transactionId())
                .detail(detail)
                .source(source)
                .status(status)
                .isTest(false)
                .isRetry(isRetry)
                .raw(raw(message))
                .build();
        try {
            ExecutionDetailEntity saved = repository.save(entity);
            log.debug("[ExecutionDetail] jobId={}, detail={}, status={}", job.jobId(), detail, status);
            return saved;
        } catch (DataAccessException e) {
            throw new AppException(CommonErrorCode.PERSISTENCE_ERROR.withDetail(
                    "execution detail not saved jobId=" + job.jobId()), e);
        }
    }

    /** {@code {"message": ...}} 형태의 raw 본문. */
    String raw(String message) {
        try {
            return objectMapper.writeValueAsString(Map.of("message", message == null ? "" : message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("raw message not serializable", e);
        }
    }
}
