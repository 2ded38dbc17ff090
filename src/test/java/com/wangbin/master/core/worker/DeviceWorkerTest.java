package com.wangbin.master.core.worker;

import com.wangbin.master.common.utils.CancellableSleeper;
import com.wangbin.master.core.buffer.BufferKind;
import com.wangbin.master.core.config.DeviceConfig;
import com.wangbin.master.core.config.IoPoint;
import com.wangbin.master.core.config.MasterProperties;
import com.wangbin.master.core.connection.ConnectionStatus;
import com.wangbin.master.core.connection.ModbusConnectionManager;
import com.wangbin.master.monitor.DeviceStatusSnapshot;
import com.wangbin.master.support.CountingPlcBuffer;
import com.wangbin.master.support.FakeModbusTransport;
import com.wangbin.master.support.TestDevices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.wangbin.master.support.TestDevices.point;
import static org.junit.jupiter.api.Assertions.*;

class DeviceWorkerTest {

    private final FakeModbusTransport transport = new FakeModbusTransport();
    private final AtomicInteger created = new AtomicInteger();
    private CountingPlcBuffer buffer;
    private MasterProperties properties;

    @BeforeEach
    void setUp() {
        buffer = new CountingPlcBuffer(64);
        properties = TestDevices.fastProperties();
    }

    @Test
    void oneTickReadsUpdatesBufferAndWrites() {
        DeviceWorker worker = worker(List.of(
                point(1, 0, "%IX0.0", 2, 100),
                point(3, 10, "%IW0", 1, 100),
                point(4, 20, "%ID4", 1, 100),
                point(6, 30, "%QW2", 1, 100),
                point(15, 40, "%QX0.0", 2, 100),
                point(16, 50, "%QD4", 1, 100)));

        transport.coils.put(0, true);
        transport.holdingRegisters.put(10, 77);
        transport.inputRegisters.put(20, 0x0001);
        transport.inputRegisters.put(21, 0x0002);
        buffer.writeWord(BufferKind.INT_OUTPUT, 1, 0x55, false);
        buffer.writeBit(BufferKind.BOOL_OUTPUT, 0, 0, true, false);
        buffer.writeBit(BufferKind.BOOL_OUTPUT, 0, 1, true, false);
        buffer.writeDWord(BufferKind.DINT_OUTPUT, 1, 0x00030004L, false);
        int acquiresBefore = buffer.getAcquires();

        assertTrue(worker.pollOnce(0));

        // 读阶段和写阶段各加锁一次
        assertEquals(acquiresBefore + 2, buffer.getAcquires());
        assertTrue(buffer.readBit(BufferKind.BOOL_INPUT, 0, 0, false).value());
        assertFalse(buffer.readBit(BufferKind.BOOL_INPUT, 0, 1, false).value());
        assertEquals(77L, buffer.readWord(BufferKind.INT_INPUT, 0, false).value());
        assertEquals(0x00020001L, buffer.readDWord(BufferKind.DINT_INPUT, 1, false).value());

        assertEquals(0x55, transport.holdingRegisters.get(30));
        assertTrue(transport.coils.get(40));
        assertTrue(transport.coils.get(41));
        assertEquals(0x0004, transport.holdingRegisters.get(50));
        assertEquals(0x0003, transport.holdingRegisters.get(51));
        assertTrue(transport.requests.contains("fc4:20:2"));

        DeviceStatusSnapshot snapshot = worker.snapshot();
        assertEquals(3, snapshot.getReadSuccess());
        assertEquals(3, snapshot.getWriteSuccess());
        assertEquals(0, snapshot.getReadFailures());
        assertEquals(1, snapshot.getTicks());
        assertEquals(ConnectionStatus.CONNECTED, snapshot.getConnectionStatus());
    }

    @Test
    void bigEndianDeviceOrdersRegistersHighWordFirst() {
        DeviceConfig device = DeviceConfig.builder()
                .name("be").host("127.0.0.1").port(502).timeoutMs(100).cycleTimeMs(100)
                .bigEndian(true)
                .ioPoints(List.of(point(3, 0, "%MD0", 1, 100), point(16, 10, "%QD0", 1, 100)))
                .build();
        DeviceWorker worker = worker(device);
        transport.holdingRegisters.put(0, 0x1234);
        transport.holdingRegisters.put(1, 0x5678);
        buffer.writeDWord(BufferKind.DINT_OUTPUT, 0, 0xAABBCCDDL, false);

        worker.pollOnce(0);

        assertEquals(0x12345678L, buffer.readDWord(BufferKind.DINT_MEMORY, 0, false).value());
        assertEquals(0xAABB, transport.holdingRegisters.get(10));
        assertEquals(0xCCDD, transport.holdingRegisters.get(11));
    }

    @Test
    void pointsArePolledAtTheirOwnRate() {
        DeviceWorker worker = worker(List.of(
                point(3, 0, "%IW0", 1, 100),
                point(3, 1, "%IW2", 1, 300)));

        for (long tick = 0; tick < 6; tick++) {
            worker.pollOnce(tick);
        }

        assertEquals(6, transport.requests.stream().filter("fc3:0:1"::equals).count());
        assertEquals(2, transport.requests.stream().filter("fc3:1:1"::equals).count());
        assertEquals(100, worker.getSchedule().getBaseTickMs());
    }

    @Test
    void readFailureMarksConnectionUnhealthyAndOtherPhasesContinue() {
        DeviceWorker worker = worker(List.of(
                point(3, 0, "%IW0", 1, 100),
                point(4, 0, "%IW2", 1, 100),
                point(6, 5, "%QW0", 1, 100)));
        buffer.writeWord(BufferKind.INT_OUTPUT, 0, 9, false);
        transport.failReads(true);

        assertTrue(worker.pollOnce(0));

        DeviceStatusSnapshot snapshot = worker.snapshot();
        assertEquals(2, snapshot.getReadFailures());
        assertEquals(1, snapshot.getWriteSuccess());
        assertFalse(snapshot.isHealthy());
        assertNotNull(snapshot.getLastError());
        assertEquals(9, transport.holdingRegisters.get(5));

        transport.failReads(false);
        assertTrue(worker.pollOnce(1));
        assertEquals(2, created.get());
        assertTrue(worker.snapshot().isHealthy());
    }

    @Test
    void writeFailureMarksConnectionUnhealthy() {
        DeviceWorker worker = worker(List.of(point(5, 0, "%QX0.0", 1, 100)));
        transport.failWrites(true);

        worker.pollOnce(0);

        assertEquals(1, worker.snapshot().getWriteFailures());
        assertFalse(worker.snapshot().isHealthy());
    }

    @Test
    void lockFailureAbandonsBatchWithoutStoppingWorker() {
        DeviceWorker worker = worker(List.of(
                point(3, 0, "%IW0", 1, 100),
                point(16, 0, "%QW0", 1, 100)));
        buffer.refuseLock(true);

        assertTrue(worker.pollOnce(0));

        DeviceStatusSnapshot snapshot = worker.snapshot();
        assertEquals(1, snapshot.getReadFailures());
        assertEquals(1, snapshot.getWriteFailures());
        assertTrue(snapshot.isHealthy());
        assertFalse(transport.requests.contains("fc16:0:1"));
    }

    @Test
    void singleWriteSendsOnlyFirstElement() {
        DeviceWorker worker = worker(List.of(point(6, 100, "%QW0", 3, 100)));
        buffer.writeWord(BufferKind.INT_OUTPUT, 0, 1, false);
        buffer.writeWord(BufferKind.INT_OUTPUT, 1, 2, false);

        worker.pollOnce(0);

        assertEquals(List.of("fc6:100:1"), transport.requests);
        assertEquals(1, transport.holdingRegisters.get(100));
        assertNull(transport.holdingRegisters.get(101));
    }

    @Test
    void deviceWithoutPointsExitsImmediately() {
        DeviceWorker worker = worker(List.of());
        worker.run();
        assertEquals(0, created.get());
        assertFalse(worker.snapshot().isRunning());
    }

    @Test
    void runLoopStopsOnSignalAndClosesConnection() throws Exception {
        DeviceWorker worker = worker(List.of(point(3, 0, "%IW0", 1, 20)));
        Thread thread = new Thread(worker, "worker-test");
        thread.start();

        long deadline = System.currentTimeMillis() + 3000;
        while (worker.snapshot().getTicks() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        worker.stop();
        thread.join(2000);

        assertFalse(thread.isAlive());
        assertTrue(worker.snapshot().getTicks() >= 3);
        assertFalse(worker.snapshot().isRunning());
        assertFalse(transport.isConnected());
        assertEquals(ConnectionStatus.DISCONNECTED, worker.snapshot().getConnectionStatus());
    }

    @Test
    void stopWhileWaitingForConnectionExits() throws Exception {
        transport.failNextConnects(Integer.MAX_VALUE);
        DeviceWorker worker = worker(List.of(point(3, 0, "%IW0", 1, 20)));
        Thread thread = new Thread(worker, "worker-retry-test");
        thread.start();

        Thread.sleep(50);
        worker.stop();
        thread.join(2000);

        assertFalse(thread.isAlive());
        assertEquals(0, worker.snapshot().getTicks());
        assertTrue(worker.snapshot().getConnectAttempts() > 0);
    }

    private DeviceWorker worker(List<IoPoint> points) {
        return worker(TestDevices.device("dev", points));
    }

    private DeviceWorker worker(DeviceConfig device) {
        CancellableSleeper sleeper = new CancellableSleeper(properties.getSleepIncrementMs());
        ModbusConnectionManager connection = new ModbusConnectionManager(device, d -> {
            created.incrementAndGet();
            return transport;
        }, properties.getRetry(), sleeper);
        return new DeviceWorker(device, connection, buffer, sleeper);
    }
}
