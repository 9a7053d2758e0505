package com.yerin.notijob.global.exception;

import com.yerin.notijob.global.exception.code.LockErrorCode;
import lombok.Getter;

/**
 * 재시도 예산 안에 쿼럼을 얻지 못했을 때 던진다. 잡 입장에서는 재시도 가능한 실패다.
 */
@Getter
public class LockAcquisitionException extends AppException {

    private final String resource;

    public LockAcquisitionException(String resource, Throwable cause) {
        super(LockErrorCode.LOCK_ACQUISITION_FAILED.withDetail("Lock " + resource + " could not be acquired"), cause);
        this.resource = resource;
    }
}
