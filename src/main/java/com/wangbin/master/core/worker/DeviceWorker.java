package com.wangbin.master.core.worker;

import com.wangbin.master.common.exception.MasterException;
import com.wangbin.master.common.exception.ModbusTransactionException;
import com.wangbin.master.common.exception.MutexAcquisitionException;
import com.wangbin.master.common.utils.CancelSignal;
import com.wangbin.master.common.utils.CancellableSleeper;
import com.wangbin.master.core.address.AccessDirection;
import com.wangbin.master.core.address.AddressResolver;
import com.wangbin.master.core.address.BufferAccessDescriptor;
import com.wangbin.master.core.buffer.BufferSynchronizer;
import com.wangbin.master.core.buffer.SharedBufferAccess;
import com.wangbin.master.core.buffer.StagedRead;
import com.wangbin.master.core.buffer.WriteSource;
import com.wangbin.master.core.codec.RegisterCodec;
import com.wangbin.master.core.config.DeviceConfig;
import com.wangbin.master.core.config.IoPoint;
import com.wangbin.master.core.connection.ModbusConnectionManager;
import com.wangbin.master.core.connection.ModbusTransport;
import com.wangbin.master.monitor.DeviceStatusSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单设备轮询线程
 * <p>
 * 每个节拍依次执行：确保连接、读阶段、批量更新缓冲区、写阶段、休眠到下一节拍。
 * 单个点位的失败只影响该点位，并把连接标记为不健康。
 */
@Slf4j
public class DeviceWorker implements Runnable {

    private final DeviceConfig device;
    private final ModbusConnectionManager connection;
    private final BufferSynchronizer synchronizer;
    private final PollingSchedule schedule;
    private final CancellableSleeper sleeper;
    private final List<IoPoint> readPoints = new ArrayList<>();
    private final List<IoPoint> writePoints = new ArrayList<>();

    private volatile boolean stopped;
    private volatile boolean running;
    private final CancelSignal cancel = () -> stopped;

    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong readSuccess = new AtomicLong();
    private final AtomicLong readFailures = new AtomicLong();
    private final AtomicLong writeSuccess = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();
    private volatile String lastError;

    public DeviceWorker(DeviceConfig device,
                        ModbusConnectionManager connection,
                        SharedBufferAccess buffer,
                        CancellableSleeper sleeper) {
        this.device = device;
        this.connection = connection;
        this.synchronizer = new BufferSynchronizer(buffer, device.getName(), device.isBigEndian());
        this.schedule = PollingSchedule.of(device.getIoPoints());
        this.sleeper = sleeper;
        for (IoPoint point : device.getIoPoints()) {
            if (point.isRead()) {
                readPoints.add(point);
            } else {
                writePoints.add(point);
            }
        }
    }

    @Override
    public void run() {
        if (device.getIoPoints().isEmpty()) {
            log.warn("设备 {} 没有配置点位，线程退出", device.getName());
            return;
        }

        running = true;
        log.info("设备 {} 轮询启动: {}, 读点位 {} 个, 写点位 {} 个, 基准节拍 {}ms",
                device.getName(), device.endpoint(), readPoints.size(), writePoints.size(), schedule.getBaseTickMs());
        long tick = 0;
        try {
            while (!stopped) {
                long start = System.nanoTime();
                try {
                    if (!pollOnce(tick)) {
                        break;
                    }
                } catch (RuntimeException e) {
                    connection.markUnhealthy();
                    lastError = e.getMessage();
                    log.error("设备 {} 第 {} 个节拍执行异常", device.getName(), tick, e);
                }

                long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                long sleepMs = Math.max(0, schedule.getBaseTickMs() - elapsed);
                if (sleepMs > 0 && !sleeper.sleep(sleepMs, cancel)) {
                    break;
                }
                tick++;
            }
        } finally {
            connection.disconnect();
            running = false;
            log.info("设备 {} 轮询已停止, 共执行 {} 个节拍", device.getName(), ticks.get());
        }
    }

    /**
     * 执行一个节拍
     *
     * @return 等待连接期间收到停止信号时返回 false
     */
    boolean pollOnce(long tick) {
        if (!connection.ensureConnection(cancel)) {
            return false;
        }
        ModbusTransport transport = connection.getTransport();

        List<StagedRead> staged = readPhase(transport, tick);
        applyReads(staged);
        writePhase(transport, tick);

        ticks.incrementAndGet();
        return true;
    }

    public void stop() {
        stopped = true;
    }

    public PollingSchedule getSchedule() {
        return schedule;
    }

    public DeviceStatusSnapshot snapshot() {
        return DeviceStatusSnapshot.builder()
                .deviceName(device.getName())
                .endpoint(device.endpoint())
                .connectionStatus(connection.getStatus())
                .healthy(connection.isHealthy())
                .running(running)
                .baseTickMs(schedule.getBaseTickMs())
                .connectAttempts(connection.getAttempts())
                .ticks(ticks.get())
                .readSuccess(readSuccess.get())
                .readFailures(readFailures.get())
                .writeSuccess(writeSuccess.get())
                .writeFailures(writeFailures.get())
                .lastError(lastError)
                .build();
    }

    // =============== 读阶段 ===============

    private List<StagedRead> readPhase(ModbusTransport transport, long tick) {
        List<StagedRead> staged = new ArrayList<>();
        for (IoPoint point : readPoints) {
            if (!schedule.isDue(point, tick)) {
                continue;
            }
            try {
                staged.add(read(transport, point));
            } catch (ModbusTransactionException e) {
                connection.markUnhealthy();
                recordFailure(readFailures, e);
                log.warn("设备 {} 读取失败 fc={} offset={}: {}",
                        device.getName(), point.getFunctionCode().getCode(), point.getRawOffset(), e.getMessage());
            } catch (MasterException e) {
                recordFailure(readFailures, e);
                log.warn("设备 {} 点位 [{}] 读取处理失败: {}", device.getName(), point, e.getMessage());
            }
        }
        return staged;
    }

    private StagedRead read(ModbusTransport transport, IoPoint point) {
        BufferAccessDescriptor descriptor = AddressResolver.resolve(point.getLocation(), AccessDirection.READ);
        int registerCount = point.getLength() * RegisterCodec.registersNeeded(point.getLocation().size());
        return switch (point.getFunctionCode()) {
            case READ_COILS -> StagedRead.ofBits(point, descriptor,
                    transport.readCoils(point.getOffset(), point.getLength()));
            case READ_DISCRETE_INPUTS -> StagedRead.ofBits(point, descriptor,
                    transport.readDiscreteInputs(point.getOffset(), point.getLength()));
            case READ_HOLDING_REGISTERS -> StagedRead.ofRegisters(point, descriptor,
                    transport.readHoldingRegisters(point.getOffset(), registerCount));
            case READ_INPUT_REGISTERS -> StagedRead.ofRegisters(point, descriptor,
                    transport.readInputRegisters(point.getOffset(), registerCount));
            default -> throw new IllegalStateException("不是读功能码: " + point.getFunctionCode());
        };
    }

    private void applyReads(List<StagedRead> staged) {
        if (staged.isEmpty()) {
            return;
        }
        try {
            int applied = synchronizer.applyReads(staged);
            readSuccess.addAndGet(applied);
            if (applied < staged.size()) {
                readFailures.addAndGet(staged.size() - applied);
            }
        } catch (MutexAcquisitionException e) {
            readFailures.addAndGet(staged.size());
            lastError = e.getMessage();
            log.warn(e.getMessage());
        }
    }

    // =============== 写阶段 ===============

    private void writePhase(ModbusTransport transport, long tick) {
        List<IoPoint> due = new ArrayList<>();
        for (IoPoint point : writePoints) {
            if (schedule.isDue(point, tick)) {
                due.add(point);
            }
        }
        if (due.isEmpty()) {
            return;
        }

        List<WriteSource> sources;
        try {
            sources = synchronizer.readWriteSources(due);
        } catch (MutexAcquisitionException e) {
            writeFailures.addAndGet(due.size());
            lastError = e.getMessage();
            log.warn(e.getMessage());
            return;
        }
        if (sources.size() < due.size()) {
            writeFailures.addAndGet(due.size() - sources.size());
        }

        for (WriteSource source : sources) {
            IoPoint point = source.point();
            try {
                write(transport, source);
                writeSuccess.incrementAndGet();
            } catch (ModbusTransactionException e) {
                connection.markUnhealthy();
                recordFailure(writeFailures, e);
                log.warn("设备 {} 写入失败 fc={} offset={}: {}",
                        device.getName(), point.getFunctionCode().getCode(), point.getRawOffset(), e.getMessage());
            } catch (MasterException e) {
                recordFailure(writeFailures, e);
                log.warn("设备 {} 点位 [{}] 写入处理失败: {}", device.getName(), point, e.getMessage());
            }
        }
    }

    private void write(ModbusTransport transport, WriteSource source) {
        IoPoint point = source.point();
        int offset = point.getOffset();
        switch (point.getFunctionCode()) {
            case WRITE_SINGLE_COIL -> transport.writeSingleCoil(offset, source.bits()[0]);
            case WRITE_MULTIPLE_COILS -> transport.writeMultipleCoils(offset, source.bits());
            case WRITE_SINGLE_REGISTER ->
                    transport.writeSingleRegister(offset, source.toRegisters(device.isBigEndian())[0]);
            case WRITE_MULTIPLE_REGISTERS ->
                    transport.writeMultipleRegisters(offset, source.toRegisters(device.isBigEndian()));
            default -> throw new IllegalStateException("不是写功能码: " + point.getFunctionCode());
        }
    }

    private void recordFailure(AtomicLong counter, MasterException e) {
        counter.incrementAndGet();
        lastError = e.getMessage();
    }
}
