package com.yerin.notijob.global.exception;

import com.yerin.notijob.global.exception.code.ErrorCode;

/**
 * 백오프 대상이 아닌 스텝 실패. 잡은 FAILED 로 끝나고 체인은 다음 잡으로 넘어간다.
 */
public class TerminalJobException extends AppException {

    public TerminalJobException(ErrorCode errorCode) {
        super(errorCode);
    }

    public TerminalJobException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }
}
