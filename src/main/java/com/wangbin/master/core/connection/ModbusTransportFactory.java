package com.wangbin.master.core.connection;

import com.wangbin.master.core.config.DeviceConfig;

/**
 * 为每次连接尝试创建新的传输实例
 */
@FunctionalInterface
public interface ModbusTransportFactory {

    ModbusTransport create(DeviceConfig device);
}
