package com.wangbin.master.common.utils;

/**
 * 停止信号
 */
@FunctionalInterface
public interface CancelSignal {

    CancelSignal NEVER = () -> false;

    boolean isCancelled();
}
