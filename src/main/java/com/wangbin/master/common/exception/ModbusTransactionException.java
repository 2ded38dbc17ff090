package com.wangbin.master.common.exception;

/**
 * 单次Modbus事务失败，调用方据此把连接标记为不健康
 */
public class ModbusTransactionException extends MasterException {

    public ModbusTransactionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    // 传输层异常：断链、超时、半开连接等
    public static ModbusTransactionException connectionError(String message, Throwable cause) {
        return new ModbusTransactionException(ErrorCode.CONNECTION_ERROR, message, cause);
    }

    // 从站返回异常响应
    public static ModbusTransactionException protocolError(String message, Throwable cause) {
        return new ModbusTransactionException(ErrorCode.PROTOCOL_ERROR, message, cause);
    }

    public boolean isProtocolError() {
        return getErrorCode() == ErrorCode.PROTOCOL_ERROR;
    }
}
