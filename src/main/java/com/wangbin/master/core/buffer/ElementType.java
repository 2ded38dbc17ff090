package com.wangbin.master.core.buffer;

import lombok.Getter;

/**
 * 共享缓冲区的元素类型
 */
@Getter
public enum ElementType {
    BOOL(1),
    BYTE(1),
    INT(2),
    DINT(4),
    LINT(8);

    private final int sizeBytes;

    ElementType(int sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    /**
     * 该类型可存储的无符号值掩码
     */
    public long getMask() {
        return switch (this) {
            case BOOL -> 0x1L;
            case BYTE -> 0xFFL;
            case INT -> 0xFFFFL;
            case DINT -> 0xFFFFFFFFL;
            case LINT -> -1L;
        };
    }
}
