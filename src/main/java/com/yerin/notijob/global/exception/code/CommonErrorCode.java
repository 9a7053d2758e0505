package com.yerin.notijob.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum CommonErrorCode implements ErrorCode {
    INVALID_PARAMETER(HttpStatus.BAD_REQUEST, "요청 파라미터가 잘못되었습니다.", "COMMON-002"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "리소스를 찾을 수 없습니다.", "COMMON-003"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부에서 에러가 발생했습니다.", "COMMON-004"),
    PERSISTENCE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "저장소 처리 중 에러가 발생했습니다.", "COMMON-005"),
    BACKEND_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "인메모리 백엔드 호출에 실패했습니다.", "COMMON-006");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
