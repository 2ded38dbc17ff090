package com.wangbin.master.core.connection;

import com.wangbin.master.common.utils.CancelSignal;
import com.wangbin.master.common.utils.CancellableSleeper;
import com.wangbin.master.core.config.DeviceConfig;
import com.wangbin.master.core.config.MasterProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * 单个从站设备的连接管理
 * <p>
 * 连接失败时无限重试并指数退避；被标记为不健康的连接在下次使用时完整重建，
 * 即使底层传输仍认为套接字处于打开状态。仅由所属设备线程调用，状态字段供监控线程读取。
 */
@Slf4j
public class ModbusConnectionManager {

    private final DeviceConfig device;
    private final ModbusTransportFactory transportFactory;
    private final MasterProperties.RetryConfig retry;
    private final CancellableSleeper sleeper;

    private ModbusTransport transport;
    private volatile boolean healthy;
    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private volatile long attempts;
    private long currentDelayMs;

    public ModbusConnectionManager(DeviceConfig device,
                                   ModbusTransportFactory transportFactory,
                                   MasterProperties.RetryConfig retry,
                                   CancellableSleeper sleeper) {
        this.device = device;
        this.transportFactory = transportFactory;
        this.retry = retry;
        this.sleeper = sleeper;
        this.currentDelayMs = retry.getInitialDelayMs();
    }

    /**
     * 循环重连直到成功
     *
     * @return 连接成功返回 true，仅在收到停止信号时返回 false
     */
    public boolean connectWithRetry(CancelSignal cancel) {
        while (!cancel.isCancelled()) {
            closeTransport();
            status = ConnectionStatus.CONNECTING;

            ModbusTransport candidate = null;
            try {
                candidate = transportFactory.create(device);
                candidate.connect();
                transport = candidate;
                healthy = true;
                status = ConnectionStatus.CONNECTED;
                if (attempts > 0) {
                    log.info("设备 {} 重连成功: {}，此前失败 {} 次", device.getName(), device.endpoint(), attempts);
                } else {
                    log.info("设备 {} 连接成功: {}", device.getName(), device.endpoint());
                }
                attempts = 0;
                currentDelayMs = retry.getInitialDelayMs();
                return true;
            } catch (RuntimeException e) {
                attempts++;
                status = ConnectionStatus.DISCONNECTED;
                if (candidate != null) {
                    closeQuietly(candidate);
                }

                long delay = Math.min(currentDelayMs, retry.getMaxDelayMs());
                if (attempts == 1 || attempts % Math.max(1, retry.getLogEveryAttempts()) == 0) {
                    log.warn("设备 {} 连接失败({}): 第 {} 次尝试, {}ms 后重试, 原因: {}",
                            device.getName(), device.endpoint(), attempts, delay, e.getMessage());
                }

                if (!sleeper.sleep(delay, cancel)) {
                    return false;
                }
                currentDelayMs = Math.min((long) (currentDelayMs * retry.getBackoffMultiplier()), retry.getMaxDelayMs());
            }
        }
        return false;
    }

    /**
     * 确保连接可用，连接健康时立即返回
     */
    public boolean ensureConnection(CancelSignal cancel) {
        if (transport != null && healthy && transport.isConnected()) {
            return true;
        }
        if (transport != null) {
            log.info("设备 {} 连接不可用(healthy={})，重新建立连接", device.getName(), healthy);
        }
        disconnect();
        return connectWithRetry(cancel);
    }

    /**
     * 标记连接不健康，下次 ensureConnection 时重建，不立即关闭套接字
     */
    public void markUnhealthy() {
        if (healthy) {
            log.debug("设备 {} 连接被标记为不健康", device.getName());
        }
        healthy = false;
    }

    public void disconnect() {
        closeTransport();
        healthy = false;
        status = ConnectionStatus.DISCONNECTED;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public ModbusTransport getTransport() {
        return transport;
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    public long getAttempts() {
        return attempts;
    }

    long getCurrentDelayMs() {
        return currentDelayMs;
    }

    private void closeTransport() {
        ModbusTransport current = transport;
        transport = null;
        if (current != null) {
            closeQuietly(current);
        }
    }

    private void closeQuietly(ModbusTransport target) {
        try {
            target.close();
        } catch (RuntimeException e) {
            log.warn("设备 {} 关闭连接异常: {}", device.getName(), e.getMessage());
        }
    }
}
