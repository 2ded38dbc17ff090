package com.wangbin.master.monitor;

import com.wangbin.master.core.connection.ConnectionStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 单个设备的运行状态快照
 */
@Data
@Builder
public class DeviceStatusSnapshot {

    private final String deviceName;
    private final String endpoint;
    private final ConnectionStatus connectionStatus;
    private final boolean healthy;
    private final boolean running;
    private final long baseTickMs;

    /**
     * 当前连续连接失败次数
     */
    private final long connectAttempts;

    private final long ticks;
    private final long readSuccess;
    private final long readFailures;
    private final long writeSuccess;
    private final long writeFailures;
    private final String lastError;

    @Builder.Default
    private final long generatedAt = Instant.now().toEpochMilli();
}
