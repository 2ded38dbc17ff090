package com.wangbin.master.core.buffer;

import lombok.Getter;

/**
 * 共享缓冲区操作状态
 */
@Getter
public enum BufferStatus {
    SUCCESS("成功"),
    INVALID_BUFFER_KIND("缓冲区类型与操作不匹配"),
    INDEX_OUT_OF_RANGE("下标越界"),
    LOCK_NOT_HELD("调用方声明已持锁但实际未持有"),
    LOCK_FAILED("获取缓冲区锁失败");

    private final String description;

    BufferStatus(String description) {
        this.description = description;
    }
}
