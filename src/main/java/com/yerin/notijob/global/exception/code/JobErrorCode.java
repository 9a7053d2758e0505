package com.yerin.notijob.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "작업을 찾을 수 없습니다.", "JOB-001"),
    NOTIFICATION_NOT_CREATED(HttpStatus.INTERNAL_SERVER_ERROR, "Notification could not be created", "JOB-002"),
    STEP_TEMPLATE_NOT_FOUND(HttpStatus.BAD_REQUEST, "Step template was not found", "JOB-003"),
    STEP_HANDLER_NOT_FOUND(HttpStatus.INTERNAL_SERVER_ERROR, "스텝 타입에 맞는 핸들러가 없습니다.", "JOB-004"),
    STEP_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "스텝 실행에 실패했습니다.", "JOB-005"),
    FILTER_BACKOFF(HttpStatus.CONFLICT, "필터 조건이 충족되지 않아 재시도가 필요합니다.", "JOB-006"),
    TEST_ONLY_OPERATION(HttpStatus.FORBIDDEN, "Allowed only in test mode", "JOB-007");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
