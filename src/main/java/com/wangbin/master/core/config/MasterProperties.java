package com.wangbin.master.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Modbus主站配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "modbus-master")
public class MasterProperties {

    /**
     * 是否在应用启动后自动启动主站
     */
    private boolean enabled = true;

    /**
     * 设备配置文件，支持类路径、绝对路径和相对路径
     */
    private String configPath = "config/modbus_master.json";

    /**
     * 停止时每个设备线程的等待时间
     */
    private long stopTimeoutMs = 5000;

    /**
     * 休眠切片，决定响应停止信号的粒度
     */
    private long sleepIncrementMs = 100;

    /**
     * 设备状态日志间隔
     */
    private long statusLogIntervalMs = 60000;

    private RetryConfig retry = new RetryConfig();

    private BufferConfig buffer = new BufferConfig();

    // =============== 配置类定义 ===============

    @Data
    public static class RetryConfig {
        private long initialDelayMs = 2000;
        private long maxDelayMs = 30000;
        private double backoffMultiplier = 1.5;
        private int logEveryAttempts = 10;
    }

    @Data
    public static class BufferConfig {
        private int size = 1024;
        private long lockTimeoutMs = 100;
    }
}
