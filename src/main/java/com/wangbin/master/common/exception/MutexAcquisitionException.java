package com.wangbin.master.common.exception;

/**
 * 共享缓冲区锁不可用
 */
public class MutexAcquisitionException extends MasterException {

    public MutexAcquisitionException(String message) {
        super(ErrorCode.MUTEX_ACQUISITION_ERROR, message);
    }
}
