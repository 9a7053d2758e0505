package com.yerin.notijob.global.exception;

import com.yerin.notijob.global.exception.code.CommonErrorCode;

/**
 * 캐시/락 백엔드 호출 실패. 호출 측에서 로그만 남기고 진행한다.
 */
public class BackendTransientException extends AppException {

    public BackendTransientException(String detail, Throwable cause) {
        super(CommonErrorCode.BACKEND_UNAVAILABLE.withDetail(detail), cause);
    }
}
