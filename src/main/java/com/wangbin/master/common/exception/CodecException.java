package com.wangbin.master.common.exception;

/**
 * 寄存器编解码误用
 */
public class CodecException extends MasterException {

    public CodecException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static CodecException insufficientRegisters(String size, int required, int actual) {
        return new CodecException(ErrorCode.INSUFFICIENT_REGISTERS,
                size + " 需要 " + required + " 个寄存器，实际只有 " + actual + " 个");
    }

    public static CodecException invalidSize(String size) {
        return new CodecException(ErrorCode.INVALID_SIZE, "数据宽度不支持寄存器转换: " + size);
    }
}
