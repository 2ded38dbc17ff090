package com.wangbin.master.core.address;

import lombok.Getter;

/**
 * IEC数据宽度
 */
@Getter
public enum IecSize {
    BIT('X', 1),
    BYTE('B', 8),
    WORD('W', 16),
    DOUBLE_WORD('D', 32),
    LONG_WORD('L', 64);

    private final char code;
    private final int bits;

    IecSize(char code, int bits) {
        this.code = code;
        this.bits = bits;
    }

    public static IecSize fromCode(char code) {
        for (IecSize size : values()) {
            if (size.code == code) {
                return size;
            }
        }
        return null;
    }
}
