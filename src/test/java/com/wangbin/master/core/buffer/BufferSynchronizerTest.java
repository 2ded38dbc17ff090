package com.wangbin.master.core.buffer;

import com.wangbin.master.common.exception.MutexAcquisitionException;
import com.wangbin.master.core.address.AccessDirection;
import com.wangbin.master.core.address.AddressResolver;
import com.wangbin.master.core.address.BufferAccessDescriptor;
import com.wangbin.master.core.config.IoPoint;
import com.wangbin.master.support.CountingPlcBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.wangbin.master.support.TestDevices.point;
import static org.junit.jupiter.api.Assertions.*;

class BufferSynchronizerTest {

    private CountingPlcBuffer buffer;
    private BufferSynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        buffer = new CountingPlcBuffer(32);
        synchronizer = new BufferSynchronizer(buffer, "dev", false);
    }

    @Test
    void appliesWholeBatchUnderOneLock() {
        IoPoint coils = point(1, 0, "%IX0.0", 3, 100);
        IoPoint words = point(3, 10, "%IW4", 2, 100);
        IoPoint dint = point(4, 20, "%MD8", 1, 100);

        int applied = synchronizer.applyReads(List.of(
                StagedRead.ofBits(coils, resolve(coils), new boolean[]{true, false, true}),
                StagedRead.ofRegisters(words, resolve(words), new int[]{11, 22}),
                StagedRead.ofRegisters(dint, resolve(dint), new int[]{0x0001, 0x0002})));

        assertEquals(3, applied);
        assertEquals(1, buffer.getAcquires());
        assertEquals(1, buffer.getReleases());

        assertTrue(buffer.readBit(BufferKind.BOOL_INPUT, 0, 0, false).value());
        assertFalse(buffer.readBit(BufferKind.BOOL_INPUT, 0, 1, false).value());
        assertTrue(buffer.readBit(BufferKind.BOOL_INPUT, 0, 2, false).value());
        assertEquals(11L, buffer.readWord(BufferKind.INT_INPUT, 2, false).value());
        assertEquals(22L, buffer.readWord(BufferKind.INT_INPUT, 3, false).value());
        assertEquals(0x00020001L, buffer.readDWord(BufferKind.DINT_MEMORY, 2, false).value());
    }

    @Test
    void bitsRollOverIntoNextByte() {
        IoPoint coils = point(2, 0, "%IX1.6", 4, 100);
        synchronizer.applyReads(List.of(
                StagedRead.ofBits(coils, resolve(coils), new boolean[]{true, true, true, true})));

        assertTrue(buffer.readBit(BufferKind.BOOL_INPUT, 1, 6, false).value());
        assertTrue(buffer.readBit(BufferKind.BOOL_INPUT, 1, 7, false).value());
        assertTrue(buffer.readBit(BufferKind.BOOL_INPUT, 2, 0, false).value());
        assertTrue(buffer.readBit(BufferKind.BOOL_INPUT, 2, 1, false).value());
        assertFalse(buffer.readBit(BufferKind.BOOL_INPUT, 2, 2, false).value());
    }

    @Test
    void outOfRangePointIsSkippedOthersApplied() {
        IoPoint tooFar = point(3, 0, "%IW62", 2, 100);
        IoPoint ok = point(3, 0, "%IW0", 1, 100);

        int applied = synchronizer.applyReads(List.of(
                StagedRead.ofRegisters(tooFar, resolve(tooFar), new int[]{1, 2}),
                StagedRead.ofRegisters(ok, resolve(ok), new int[]{5})));

        assertEquals(1, applied);
        assertEquals(5L, buffer.readWord(BufferKind.INT_INPUT, 0, false).value());
    }

    @Test
    void lockFailureAbandonsBatch() {
        buffer.refuseLock(true);
        IoPoint words = point(3, 0, "%IW0", 1, 100);
        assertThrows(MutexAcquisitionException.class, () -> synchronizer.applyReads(List.of(
                StagedRead.ofRegisters(words, resolve(words), new int[]{9}))));
        assertThrows(MutexAcquisitionException.class, () -> synchronizer.readWriteSources(List.of(
                point(16, 0, "%QW0", 1, 100))));
        assertEquals(0, buffer.getReleases());

        buffer.refuseLock(false);
        assertEquals(0L, buffer.readWord(BufferKind.INT_INPUT, 0, false).value());
    }

    @Test
    void emptyBatchDoesNotTouchTheLock() {
        assertEquals(0, synchronizer.applyReads(List.of()));
        assertTrue(synchronizer.readWriteSources(List.of()).isEmpty());
        assertEquals(0, buffer.getAcquires());
    }

    @Test
    void readsWriteSourcesUnderOneLock() {
        buffer.writeBit(BufferKind.BOOL_OUTPUT, 0, 7, true, false);
        buffer.writeBit(BufferKind.BOOL_OUTPUT, 1, 0, true, false);
        buffer.writeWord(BufferKind.INT_OUTPUT, 1, 0x1234, false);
        buffer.writeDWord(BufferKind.DINT_OUTPUT, 1, 65536, false);
        int before = buffer.getAcquires();

        List<WriteSource> sources = synchronizer.readWriteSources(List.of(
                point(15, 0, "%QX0.6", 3, 100),
                point(6, 0, "%QW2", 3, 100),
                point(16, 0, "%QD4", 1, 100)));

        assertEquals(before + 1, buffer.getAcquires());
        assertEquals(3, sources.size());
        assertArrayEquals(new boolean[]{false, true, true}, sources.get(0).bits());
        // 单点写只取第一个元素
        assertArrayEquals(new long[]{0x1234}, sources.get(1).values());
        assertArrayEquals(new int[]{0x0000, 0x0001}, sources.get(2).toRegisters(false));
        assertArrayEquals(new int[]{0x0001, 0x0000}, sources.get(2).toRegisters(true));
    }

    private static BufferAccessDescriptor resolve(IoPoint point) {
        return AddressResolver.resolve(point.getLocation(), AccessDirection.READ);
    }
}
