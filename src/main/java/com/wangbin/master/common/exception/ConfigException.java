package com.wangbin.master.common.exception;

import lombok.Getter;

/**
 * 设备配置异常
 */
@Getter
public class ConfigException extends MasterException {

    private final String deviceName;

    public ConfigException(ErrorCode errorCode, String message, String deviceName) {
        super(errorCode, message);
        this.deviceName = deviceName;
    }

    public ConfigException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.deviceName = null;
    }

    public static ConfigException invalid(String deviceName, String message) {
        String prefix = deviceName != null ? "设备 " + deviceName + " 配置无效: " : "配置无效: ";
        return new ConfigException(ErrorCode.CONFIG_INVALID, prefix + message, deviceName);
    }

    public static ConfigException loadError(String message, Throwable cause) {
        return new ConfigException(ErrorCode.CONFIG_LOAD_ERROR, message, cause);
    }
}
