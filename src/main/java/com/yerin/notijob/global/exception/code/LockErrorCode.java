package com.yerin.notijob.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum LockErrorCode implements ErrorCode {
    LOCK_ACQUISITION_FAILED(HttpStatus.CONFLICT, "분산 락을 획득하지 못했습니다.", "LOCK-001");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
