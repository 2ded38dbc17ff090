package com.wangbin.master.core.connection;

import lombok.Getter;

/**
 * 连接状态枚举
 */
@Getter
public enum ConnectionStatus {

    DISCONNECTED("DISCONNECTED", "已断开"),
    CONNECTING("CONNECTING", "连接中"),
    CONNECTED("CONNECTED", "已连接");

    private final String code;
    private final String description;

    ConnectionStatus(String code, String description) {
        this.code = code;
        this.description = description;
    }

    // 判断是否已连接
    public boolean isConnected() {
        return this == CONNECTED;
    }
}
