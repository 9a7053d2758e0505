package com.yerin.notijob.application;

import com.yerin.notijob.global.exception.AppException;
import com.yerin.notijob.global.exception.code.CommonErrorCode;
import com.yerin.notijob.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.IntSupplier;

/**
 * 잡 상태 전이. 모두 조건부 UPDATE 라서 같은 전이를 여러 번 호출해도 결과가 같다.
 * COMPLETED 에서 다른 상태로는 가지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStatusService {

    private final JobRepository jobRepository;

    /** @return false 면 이미 종료 상태라 실행하지 않아야 한다 */
    @Transactional
    public boolean setRunning(String jobId, String environmentId, int attempts) {
        return update("RUNNING", jobId, () -> jobRepository.markRunning(jobId, environmentId, attempts)) > 0;
    }

    @Transactional
    public void setPending(String jobId, String environmentId, int attempts) {
        update("PENDING", jobId, () -> jobRepository.markPendingForRetry(jobId, environmentId, attempts));
    }

    @Transactional
    public void setCompleted(String jobId, String environmentId) {
        update("COMPLETED", jobId, () -> jobRepository.completeIfNotCompleted(jobId, environmentId));
    }

    @Transactional
    public void setFailed(String jobId, String environmentId, String error) {
        update("FAILED", jobId, () -> jobRepository.failIfNotCompleted(jobId, environmentId, error));
    }

    private int update(String target, String jobId, IntSupplier query) {
        int updated;
        try {
            updated = query.getAsInt();
        } catch (DataAccessException e) {
            throw new AppException(CommonErrorCode.PERSISTENCE_ERROR.withDetail(
                    "job status update to " + target + " failed jobId=" + jobId), e);
        }
        if (updated == 0) {
            log.debug("[JobStatus] no transition to {} jobId={}", target, jobId);
        }
        return updated;
    }
}
