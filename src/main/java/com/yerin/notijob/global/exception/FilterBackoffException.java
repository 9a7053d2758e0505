package com.yerin.notijob.global.exception;

import com.yerin.notijob.global.exception.code.JobErrorCode;

/**
 * 웹훅 필터 등 외부 조건 대기로 인한 실패. 워커가 백오프 후 재시도한다.
 */
public class FilterBackoffException extends AppException {

    public FilterBackoffException(String message) {
        super(JobErrorCode.FILTER_BACKOFF.withDetail(message));
    }
}
