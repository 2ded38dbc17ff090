package com.wangbin.master.core.config;

import lombok.Getter;

/**
 * Modbus功能码
 */
@Getter
public enum FunctionCode {

    READ_COILS(1, "读线圈", true, true, 2000),
    READ_DISCRETE_INPUTS(2, "读离散输入", true, true, 2000),
    READ_HOLDING_REGISTERS(3, "读保持寄存器", true, false, 125),
    READ_INPUT_REGISTERS(4, "读输入寄存器", true, false, 125),
    WRITE_SINGLE_COIL(5, "写单个线圈", false, true, 1),
    WRITE_SINGLE_REGISTER(6, "写单个寄存器", false, false, 1),
    WRITE_MULTIPLE_COILS(15, "写多个线圈", false, true, 1968),
    WRITE_MULTIPLE_REGISTERS(16, "写多个寄存器", false, false, 123);

    private final int code;
    private final String description;
    private final boolean read;
    private final boolean coil;
    /**
     * 单次请求允许的最大线圈数或寄存器数
     */
    private final int maxQuantity;

    FunctionCode(int code, String description, boolean read, boolean coil, int maxQuantity) {
        this.code = code;
        this.description = description;
        this.read = read;
        this.coil = coil;
        this.maxQuantity = maxQuantity;
    }

    /**
     * 只写第一个元素的单点写功能码
     */
    public boolean isSingleWrite() {
        return this == WRITE_SINGLE_COIL || this == WRITE_SINGLE_REGISTER;
    }

    public static FunctionCode fromCode(int code) {
        for (FunctionCode fc : values()) {
            if (fc.code == code) {
                return fc;
            }
        }
        return null;
    }
}
