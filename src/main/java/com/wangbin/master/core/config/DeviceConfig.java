package com.wangbin.master.core.config;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 从站设备配置，加载后不可变
 */
@Getter
@Builder
public class DeviceConfig {

    public static final String PROTOCOL_MODBUS = "MODBUS";
    public static final int DEFAULT_UNIT_ID = 1;

    private final String name;
    private final String host;
    private final int port;
    private final long timeoutMs;
    private final long cycleTimeMs;

    @Builder.Default
    private final int unitId = DEFAULT_UNIT_ID;

    @Builder.Default
    private final boolean bigEndian = false;

    @Builder.Default
    private final List<IoPoint> ioPoints = Collections.emptyList();

    public String endpoint() {
        return host + ":" + port;
    }
}
