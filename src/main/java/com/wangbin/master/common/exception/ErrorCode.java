package com.wangbin.master.common.exception;

import lombok.Getter;

/**
 * 主站错误码
 */
@Getter
public enum ErrorCode {

    // 地址相关错误
    ADDRESS_PARSE_ERROR(2101, "IEC地址解析失败"),
    UNSUPPORTED_ADDRESS(2102, "不支持的IEC地址"),

    // 编解码错误
    INSUFFICIENT_REGISTERS(2201, "寄存器数量不足"),
    INVALID_SIZE(2202, "无效的数据宽度"),

    // 通讯错误
    CONNECTION_ERROR(2301, "连接错误"),
    PROTOCOL_ERROR(2302, "协议错误"),

    // 共享缓冲区错误
    MUTEX_ACQUISITION_ERROR(2401, "获取缓冲区锁失败"),

    // 配置相关错误
    CONFIG_INVALID(3002, "配置无效"),
    CONFIG_LOAD_ERROR(3003, "配置加载错误"),

    // 生命周期错误
    DEVICE_START_ERROR(4001, "设备线程启动失败");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }
}
