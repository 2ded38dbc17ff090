package com.wangbin.master.core.master;

import com.wangbin.master.common.exception.ConfigException;
import com.wangbin.master.core.config.DeviceConfig;
import com.wangbin.master.core.config.DeviceConfigLoader;
import com.wangbin.master.core.config.MasterProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 应用就绪后加载设备配置并启动主站，容器关闭时停止
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MasterLifecycle {

    private final MasterProperties properties;
    private final DeviceConfigLoader configLoader;
    private final MasterSupervisor supervisor;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    /**
     * @return 启动的设备数，未启用或配置无效时为 0
     */
    public int start() {
        if (!properties.isEnabled()) {
            log.info("Modbus 主站未启用 (modbus-master.enabled=false)");
            return 0;
        }

        List<DeviceConfig> devices;
        try {
            devices = configLoader.loadFromPath(properties.getConfigPath());
        } catch (ConfigException e) {
            log.error("加载设备配置失败 [{}]: {}", e.getErrorCode(), e.getMessage(), e);
            return 0;
        }

        if (devices.isEmpty()) {
            log.warn("设备配置为空: {}", properties.getConfigPath());
            return 0;
        }
        return supervisor.start(devices);
    }

    @PreDestroy
    public void stop() {
        supervisor.stop(properties.getStopTimeoutMs());
    }
}
