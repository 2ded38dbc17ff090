package com.wangbin.master.monitor;

import com.wangbin.master.core.master.MasterSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 定时输出设备运行状态
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MasterStatusReporter {

    private final MasterSupervisor supervisor;

    @Scheduled(fixedDelayString = "${modbus-master.status-log-interval-ms:60000}",
            initialDelayString = "${modbus-master.status-log-interval-ms:60000}")
    public void report() {
        List<DeviceStatusSnapshot> snapshots = supervisor.snapshot();
        if (snapshots.isEmpty()) {
            return;
        }

        long connected = snapshots.stream().filter(s -> s.getConnectionStatus().isConnected()).count();
        log.info("Modbus 主站状态: {}/{} 个设备已连接", connected, snapshots.size());
        for (DeviceStatusSnapshot snapshot : snapshots) {
            log.info("  {} [{}] {} healthy={} ticks={} read={}/{} write={}/{} attempts={} lastError={}",
                    snapshot.getDeviceName(),
                    snapshot.getEndpoint(),
                    snapshot.getConnectionStatus().getDescription(),
                    snapshot.isHealthy(),
                    snapshot.getTicks(),
                    snapshot.getReadSuccess(),
                    snapshot.getReadFailures(),
                    snapshot.getWriteSuccess(),
                    snapshot.getWriteFailures(),
                    snapshot.getConnectAttempts(),
                    snapshot.getLastError());
        }
    }
}
