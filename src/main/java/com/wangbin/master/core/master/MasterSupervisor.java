package com.wangbin.master.core.master;

import com.wangbin.master.common.exception.ErrorCode;
import com.wangbin.master.common.exception.MasterException;
import com.wangbin.master.common.utils.CancellableSleeper;
import com.wangbin.master.core.buffer.SharedBufferAccess;
import com.wangbin.master.core.config.DeviceConfig;
import com.wangbin.master.core.config.MasterProperties;
import com.wangbin.master.core.connection.ModbusConnectionManager;
import com.wangbin.master.core.connection.ModbusTransportFactory;
import com.wangbin.master.core.worker.DeviceWorker;
import com.wangbin.master.monitor.DeviceStatusSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadFactory;

/**
 * 主站调度：每个设备一个轮询线程
 */
@Slf4j
public class MasterSupervisor {

    private final SharedBufferAccess buffer;
    private final MasterProperties properties;
    private final ModbusTransportFactory transportFactory;
    private final ThreadFactory threadFactory;

    private final Map<String, RunningWorker> workers = new LinkedHashMap<>();

    public MasterSupervisor(SharedBufferAccess buffer,
                            MasterProperties properties,
                            ModbusTransportFactory transportFactory,
                            ThreadFactory threadFactory) {
        this.buffer = buffer;
        this.properties = properties;
        this.transportFactory = transportFactory;
        this.threadFactory = threadFactory;
    }

    /**
     * 为每个设备启动轮询线程，单个设备启动失败不影响其他设备
     *
     * @return 成功启动的设备数
     */
    public synchronized int start(List<DeviceConfig> devices) {
        if (!workers.isEmpty()) {
            log.warn("主站已在运行 {} 个设备，忽略重复启动", workers.size());
            return workers.size();
        }

        for (DeviceConfig device : devices) {
            try {
                workers.put(device.getName(), startWorker(device));
            } catch (MasterException e) {
                log.error("设备 {} 启动失败 [{}]: {}", device.getName(), e.getCode(), e.getMessage(), e.getCause());
            }
        }

        if (workers.isEmpty()) {
            log.error("没有任何设备启动成功, 共配置 {} 个设备", devices.size());
        } else {
            log.info("主站启动完成: {}/{} 个设备", workers.size(), devices.size());
        }
        return workers.size();
    }

    /**
     * 通知所有设备线程停止并逐个等待，超时的线程只记录日志
     * <p>
     * 等待在监视器之外进行，停止期间状态查询不会被阻塞。
     */
    public void stop(long timeoutPerWorkerMs) {
        Map<String, RunningWorker> stopping;
        synchronized (this) {
            if (workers.isEmpty()) {
                return;
            }
            stopping = new LinkedHashMap<>(workers);
            workers.clear();
        }

        log.info("正在停止 {} 个设备线程", stopping.size());
        stopping.values().forEach(running -> running.worker().stop());

        for (Map.Entry<String, RunningWorker> entry : stopping.entrySet()) {
            Thread thread = entry.getValue().thread();
            try {
                thread.join(timeoutPerWorkerMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("等待设备 {} 停止时被中断", entry.getKey());
                break;
            }
            if (thread.isAlive()) {
                log.warn("设备 {} 线程 {} 在 {}ms 内未停止", entry.getKey(), thread.getName(), timeoutPerWorkerMs);
            }
        }
        log.info("主站已停止");
    }

    public synchronized List<DeviceStatusSnapshot> snapshot() {
        List<DeviceStatusSnapshot> snapshots = new ArrayList<>(workers.size());
        workers.values().forEach(running -> snapshots.add(running.worker().snapshot()));
        return snapshots;
    }

    public synchronized boolean isRunning() {
        return !workers.isEmpty();
    }

    public synchronized int getWorkerCount() {
        return workers.size();
    }

    private RunningWorker startWorker(DeviceConfig device) {
        if (workers.containsKey(device.getName())) {
            throw new MasterException(ErrorCode.DEVICE_START_ERROR, "设备名称重复: " + device.getName());
        }
        try {
            CancellableSleeper sleeper = new CancellableSleeper(properties.getSleepIncrementMs());
            ModbusConnectionManager connection = new ModbusConnectionManager(
                    device, transportFactory, properties.getRetry(), sleeper);
            DeviceWorker worker = new DeviceWorker(device, connection, buffer, sleeper);

            Thread thread = threadFactory.newThread(worker);
            thread.start();
            log.debug("设备 {} 线程 {} 已启动", device.getName(), thread.getName());
            return new RunningWorker(worker, thread);
        } catch (RuntimeException e) {
            throw new MasterException(ErrorCode.DEVICE_START_ERROR,
                    "设备 " + device.getName() + " 线程创建失败: " + e.getMessage(), e);
        }
    }

    private record RunningWorker(DeviceWorker worker, Thread thread) {
    }
}
