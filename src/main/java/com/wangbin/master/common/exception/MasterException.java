package com.wangbin.master.common.exception;

import lombok.Getter;

/**
 * 主站异常基类
 */
@Getter
public class MasterException extends RuntimeException {

    private final ErrorCode errorCode;

    public MasterException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MasterException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getCode() {
        return errorCode.getCode();
    }
}
